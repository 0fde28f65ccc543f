package com.example.fileingest.content;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PathClassifierTest {
    private static final Instant MID_2023 = Instant.parse("2023-06-15T12:00:00Z");

    private final PathClassifier classifier = new PathClassifier(
            List.of("ORGA", "INFRA"), true, List.of("Projekte", "Archiv"), ZoneOffset.UTC);

    @Test
    void customerCodeInDirectoryWins() {
        Path path = Path.of("/shares/kunden/10023_Mueller GmbH/orga/angebot.pdf");

        assertEquals("10023_Mueller GmbH", classifier.customerRoot(path));
    }

    @Test
    void customerCodeInFileNameIsIgnored() {
        Path path = Path.of("/shares/misc/1234_acme.pdf");

        assertEquals(PathClassifier.FALLBACK_CUSTOMER, classifier.customerRoot(path));
    }

    @Test
    void internalRootMatchesCaseInsensitively() {
        assertEquals("INFRA", classifier.customerRoot(Path.of("/shares/infra/server/notes.txt")));
    }

    @Test
    void fallsBackToGenericCustomer() {
        assertEquals(PathClassifier.FALLBACK_CUSTOMER, classifier.customerRoot(Path.of("/shares/random/file.txt")));
    }

    @Test
    void firstMatchingSubfolderWins() {
        assertEquals("Projekte", classifier.subfolder(Path.of("/a/projekt_website/plan.pdf")));
        assertEquals("Portale", classifier.subfolder(Path.of("/a/portal/readme.md")));
        assertEquals("Kampagnen", classifier.subfolder(Path.of("/a/Campaign-2024.pptx")));
        assertEquals("Angebote", classifier.subfolder(Path.of("/a/Angebot_17.docx")));
        assertEquals("Archiv", classifier.subfolder(Path.of("/a/archive/old.zip")));
        assertEquals(PathClassifier.FALLBACK_SUBFOLDER, classifier.subfolder(Path.of("/a/b/c.txt")));
    }

    @Test
    void yearSegmentOnlyForEligibleSubfolders() {
        Path base = Path.of("/sorted");

        assertEquals(base.resolve("ORGA/Projekte/2023"), classifier.targetDirectory(base, "ORGA", "Projekte", MID_2023));
        assertEquals(base.resolve("ORGA/Portale"), classifier.targetDirectory(base, "ORGA", "Portale", MID_2023));
    }

    @Test
    void yearFoldersCanBeDisabled() {
        PathClassifier flat = new PathClassifier(List.of(), false, List.of("Projekte"), ZoneOffset.UTC);

        assertEquals(Path.of("/sorted/ORGA/Projekte"),
                flat.targetDirectory(Path.of("/sorted"), "ORGA", "Projekte", MID_2023));
    }

    @Test
    void mapsConfirmedCategoriesToSubfolders() {
        assertEquals("Archiv", classifier.subfolderForCategory("Finanzen"));
        assertEquals("Projekte", classifier.subfolderForCategory("footage"));
        assertEquals(PathClassifier.FALLBACK_SUBFOLDER, classifier.subfolderForCategory("something-else"));
    }

    @Test
    void recognisesQuarantinePaths() {
        assertTrue(PathClassifier.isQuarantined(Path.of("/sorted/ORGA/_duplicates/x.pdf")));
        assertFalse(PathClassifier.isQuarantined(Path.of("/sorted/ORGA/Allgemein/x.pdf")));
    }
}
