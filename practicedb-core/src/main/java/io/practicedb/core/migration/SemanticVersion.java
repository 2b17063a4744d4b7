package io.practicedb.core.migration;

/**
 * Dot-separated numeric version comparison. Missing parts count as 0, so {@code 1.1} equals
 * {@code 1.1.0}; non-numeric parts also count as 0.
 */
public final class SemanticVersion {

    private SemanticVersion() {
    }

    public static int compare(String v1, String v2) {
        String[] parts1 = v1.split("\\.");
        String[] parts2 = v2.split("\\.");
        int length = Math.max(parts1.length, parts2.length);
        for (int i = 0; i < length; i++) {
            long p1 = i < parts1.length ? parse(parts1[i]) : 0;
            long p2 = i < parts2.length ? parse(parts2[i]) : 0;
            if (p1 != p2) {
                return p1 > p2 ? 1 : -1;
            }
        }
        return 0;
    }

    private static long parse(String part) {
        try {
            return Long.parseLong(part.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
