package com.example.fileingest.index;

import java.nio.file.Path;

/**
 * What {@link DuplicateResolver} did with one observed file.
 *
 * @param primaryPath     location of the primary copy afterwards
 * @param quarantinedPath file moved into quarantine, or null
 */
public record Resolution(Outcome outcome, Path primaryPath, Path quarantinedPath) {

    /**
     * {@code moved} counts first placements only; {@code duplicate} counts every duplicate decision.
     */
    public enum Outcome {
        /** First sighting of the digest; file moved to its classified destination. */
        STORED(true, false),
        /** First sighting, file already sat at its classified destination. */
        INDEXED_IN_PLACE(false, false),
        /** The file is the indexed primary itself. */
        ALREADY_PRIMARY(false, false),
        /** The observed file won and took over the primary path; the previous primary went to quarantine. */
        REPLACED_PRIMARY(false, true),
        /** The existing primary won; the observed file went to quarantine. */
        QUARANTINED(false, true);

        private final boolean moved;
        private final boolean duplicate;

        Outcome(boolean moved, boolean duplicate) {
            this.moved = moved;
            this.duplicate = duplicate;
        }

        public boolean moved() {
            return moved;
        }

        public boolean duplicate() {
            return duplicate;
        }
    }
}
