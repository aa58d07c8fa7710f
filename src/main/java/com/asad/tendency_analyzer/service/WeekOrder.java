package com.asad.tendency_analyzer.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Display order for week labels: regular-season weeks ascending, then the playoff
 * rounds WC, DP, CC, SB. Labels that are neither are dropped.
 */
public final class WeekOrder {

    public static final List<String> PLAYOFF_ROUNDS = List.of("WC", "DP", "CC", "SB");

    private WeekOrder() {}

    public static List<String> sort(Collection<String> weeks) {
        TreeSet<BigInteger> numeric = new TreeSet<>();
        TreeSet<String> seen = new TreeSet<>();

        for (String w : weeks) {
            if (w == null) continue;
            if (!w.isEmpty() && w.chars().allMatch(Character::isDigit)) {
                numeric.add(new BigInteger(w));
            } else {
                seen.add(w);
            }
        }

        List<String> out = new ArrayList<>();
        for (BigInteger n : numeric) out.add(String.valueOf(n));
        for (String round : PLAYOFF_ROUNDS) {
            if (seen.contains(round)) out.add(round);
        }
        return out;
    }
}
