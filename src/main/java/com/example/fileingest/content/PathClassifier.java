package com.example.fileingest.content;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a file path to its place in the sorted tree: customer root, subfolder and optional year folder.
 * All methods are pure.
 */
public final class PathClassifier {
    public static final String FALLBACK_CUSTOMER = "ALLGEMEIN";
    public static final String FALLBACK_SUBFOLDER = "Allgemein";
    public static final String QUARANTINE_DIRECTORY = "_duplicates";

    private static final Pattern CUSTOMER_CODE = Pattern.compile("(\\d{4,6})_([\\w\\- ]+)", Pattern.UNICODE_CHARACTER_CLASS);

    // Order matters: the first category with a matching keyword wins.
    private static final Map<String, List<String>> SUBFOLDER_KEYWORDS = new LinkedHashMap<>();

    static {
        SUBFOLDER_KEYWORDS.put("Projekte", List.of("projekt", "projects", "proj_"));
        SUBFOLDER_KEYWORDS.put("Portale", List.of("portal", "website", "site"));
        SUBFOLDER_KEYWORDS.put("Kampagnen", List.of("kampagne", "campaign"));
        SUBFOLDER_KEYWORDS.put("Angebote", List.of("angebot", "offer", "quote"));
        SUBFOLDER_KEYWORDS.put("Archiv", List.of("archiv", "archive"));
    }

    private static final Map<String, String> CATEGORY_SUBFOLDERS = Map.of(
            "finanzen", "Archiv",
            "projekte", "Projekte",
            "personal", "Archiv",
            "footage", "Projekte",
            "unsorted", FALLBACK_SUBFOLDER
    );

    private final List<String> internalRoots;
    private final boolean enableYearSubfolders;
    private final Set<String> yearFoldersUnder;
    private final ZoneId zone;

    public PathClassifier(List<String> internalRoots, boolean enableYearSubfolders, List<String> yearFoldersUnder) {
        this(internalRoots, enableYearSubfolders, yearFoldersUnder, ZoneId.systemDefault());
    }

    public PathClassifier(List<String> internalRoots,
                          boolean enableYearSubfolders,
                          List<String> yearFoldersUnder,
                          ZoneId zone) {
        this.internalRoots = List.copyOf(internalRoots);
        this.enableYearSubfolders = enableYearSubfolders;
        this.yearFoldersUnder = Set.copyOf(yearFoldersUnder);
        this.zone = zone;
    }

    /**
     * Finds a {@code NNNN_name} customer code in the directory part of the path, then an internal
     * department root anywhere in the path, then falls back to {@link #FALLBACK_CUSTOMER}.
     */
    public String customerRoot(Path path) {
        Path parent = path.getParent();
        if (parent != null) {
            Matcher matcher = CUSTOMER_CODE.matcher(parent.toString());
            if (matcher.find()) {
                return matcher.group(0);
            }
        }
        String lower = path.toString().toLowerCase(Locale.ROOT);
        for (String root : internalRoots) {
            if (lower.contains(root.toLowerCase(Locale.ROOT))) {
                return root;
            }
        }
        return FALLBACK_CUSTOMER;
    }

    public String subfolder(Path path) {
        String lower = path.toString().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : SUBFOLDER_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return FALLBACK_SUBFOLDER;
    }

    /**
     * Subfolder used when an operator confirms a classification category by hand.
     */
    public String subfolderForCategory(String category) {
        if (category == null) {
            return FALLBACK_SUBFOLDER;
        }
        return CATEGORY_SUBFOLDERS.getOrDefault(category.toLowerCase(Locale.ROOT), FALLBACK_SUBFOLDER);
    }

    /**
     * Appends a year segment only when year folders are enabled and the subfolder is year-eligible.
     */
    public Path targetDirectory(Path base, String customerRoot, String subfolder, Instant modifiedTime) {
        Path directory = base.resolve(customerRoot).resolve(subfolder);
        if (enableYearSubfolders && yearFoldersUnder.contains(subfolder)) {
            return directory.resolve(String.valueOf(yearOf(modifiedTime)));
        }
        return directory;
    }

    public Path quarantineDirectory(Path base, String customerRoot) {
        return base.resolve(customerRoot).resolve(QUARANTINE_DIRECTORY);
    }

    public int yearOf(Instant instant) {
        return instant.atZone(zone).getYear();
    }

    public static boolean isQuarantined(Path path) {
        for (Path segment : path) {
            if (QUARANTINE_DIRECTORY.equals(segment.toString())) {
                return true;
            }
        }
        return false;
    }
}
