package com.asad.tendency_analyzer.service;

import java.util.Locale;
import java.util.Set;

/**
 * Lenient parsers for the irregular text fields of the play feed.
 * None of these throw: a value that can't be read falls back as documented.
 */
public final class PlayFieldParser {

    private static final Set<String> MAN_COVERAGES =
            Set.of("COVER 0", "COVER 1", "COVER 1 DOUBLE", "COVER 2 MAN");

    private static final Set<String> COVER_3_VARIANTS =
            Set.of("COVER 3 CLOUD", "COVER 3 DBL CLOUD", "COVER 3 SEAM");

    private PlayFieldParser() {}

    /** "14:53" -> 14. Null or unreadable -> 0. */
    public static int parseClockToMinutes(String clock) {
        if (clock == null) return 0;
        try {
            String[] t = clock.split(":", -1);
            return Integer.parseInt(t[0].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** "4; PHI 53 (LILB); PHI 90 (NRT)" -> 4. Null or unreadable -> 0. */
    public static int parsePassRushers(String field) {
        if (field == null) return 0;
        try {
            String[] t = field.split(";", -1);
            return Integer.parseInt(t[0].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * "1x3" -> "3x1", "2x2" stays. Anything not shaped like two integers around an
     * 'x' comes back untouched.
     */
    public static String normalizeFormationGroup(String formation) {
        if (formation == null) return null;
        if (!formation.contains("x")) return formation;

        String[] parts = formation.split("x", -1);
        if (parts.length != 2) return formation;

        try {
            int a = Integer.parseInt(parts[0].trim());
            int b = Integer.parseInt(parts[1].trim());
            return Math.max(a, b) + "x" + Math.min(a, b);
        } catch (NumberFormatException e) {
            return formation;
        }
    }

    /** Upper-cased and trimmed; the Cover 3 variants collapse into "COVER 3". */
    public static String normalizeCoverage(String coverage) {
        if (coverage == null) return null;
        String c = coverage.trim().toUpperCase(Locale.ROOT);
        if (COVER_3_VARIANTS.contains(c)) return "COVER 3";
        return c;
    }

    public static boolean isManCoverage(String coverage) {
        if (coverage == null) return false;
        return MAN_COVERAGES.contains(coverage.trim().toUpperCase(Locale.ROOT));
    }

    public static String qbAlignment(String shotgun) {
        return "S".equals(shotgun) ? "Shotgun" : "Under Center";
    }
}
