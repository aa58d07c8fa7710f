package com.asad.tendency_analyzer.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Percentages and "top N" lists shared by the offense and defense tables.
 */
final class TendencyMath {

    private TendencyMath() {}

    /** count / denominator * 100, or 0 when there is nothing to divide by. */
    static double pct(long count, long denominator) {
        if (denominator == 0) return 0;
        return (double) count / denominator * 100;
    }

    /** One decimal, half-even on the exact binary value: 12.25 -> "12.2". */
    static String formatPct(double pct) {
        return new BigDecimal(pct).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Most frequent non-null values as "NAME (12.5%)". Equal counts keep the order
     * in which the values first appeared.
     */
    static List<String> topValues(Iterable<String> values, long denominator, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String v : values) {
            if (v == null) continue;
            counts.merge(v, 1, Integer::sum);
        }

        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
        // List.sort is stable
        sorted.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<String> out = new ArrayList<>();
        for (int i = 0; i < sorted.size() && i < limit; i++) {
            Map.Entry<String, Integer> e = sorted.get(i);
            out.add(e.getKey() + " (" + formatPct(pct(e.getValue(), denominator)) + "%)");
        }
        return out;
    }
}
