package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.config.TendencyProperties;
import com.asad.tendency_analyzer.model.DefenseCategoryRow;
import com.asad.tendency_analyzer.model.DefenseOverall;
import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayCategory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defensive tendencies. Blitz, man, MOFO and coverage shares are taken over pass
 * plays only; disguise only over pass plays where both the shown and the played
 * shell were charted.
 */
@Service
public class DefenseTendencyService {

    static final Comparator<DefenseCategoryRow> BY_USAGE =
            Comparator.comparingDouble((DefenseCategoryRow r) -> r.usagePct).reversed()
                    .thenComparing(r -> r.category);

    private final int topEntries;

    public DefenseTendencyService(TendencyProperties properties) {
        this.topEntries = properties.getTopEntries();
    }

    public DefenseOverall overall(List<Play> plays) {
        DefenseOverall o = new DefenseOverall();
        o.totalPlays = plays.size();

        Counts c = Counts.of(plays);
        o.passPlays = c.passes;
        if (c.passes == 0) return o;

        o.blitzPct = TendencyMath.pct(c.blitzes, c.passes);
        o.manPct = TendencyMath.pct(c.man, c.passes);
        o.mofoPct = TendencyMath.pct(c.mofo, c.passes);
        o.disguisePct = TendencyMath.pct(c.disguises, c.withMofoData);
        o.topCoverages = topCoverages(plays, c.passes);
        return o;
    }

    /**
     * Usage is the category's share of every play in the input; the other rates
     * use the category's own pass plays.
     */
    public List<DefenseCategoryRow> byCategory(List<Play> plays, PlayCategory category) {
        if (plays.isEmpty()) return List.of();

        int total = plays.size();
        Map<String, List<Play>> groups = new LinkedHashMap<>();
        for (Play p : plays) {
            String key = category.keyOf(p);
            if (key == null) continue;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }

        List<DefenseCategoryRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<Play>> g : groups.entrySet()) {
            List<Play> group = g.getValue();
            Counts c = Counts.of(group);

            DefenseCategoryRow row = new DefenseCategoryRow(g.getKey(), c.plays);
            row.passPlays = c.passes;
            row.usagePct = TendencyMath.pct(c.plays, total);
            row.blitzPct = TendencyMath.pct(c.blitzes, c.passes);
            row.manPct = TendencyMath.pct(c.man, c.passes);
            row.mofoPct = TendencyMath.pct(c.mofo, c.passes);
            row.disguisePct = TendencyMath.pct(c.disguises, c.withMofoData);
            row.topCoverages = String.join("\n", topCoverages(group, c.passes));
            rows.add(row);
        }

        rows.sort(BY_USAGE);
        return rows;
    }

    private List<String> topCoverages(List<Play> plays, int passes) {
        if (passes == 0) return List.of();
        List<String> coverages = new ArrayList<>(passes);
        for (Play p : plays) {
            if (p.isPass()) coverages.add(p.coverage);
        }
        return TendencyMath.topValues(coverages, passes, topEntries);
    }

    private static final class Counts {
        int plays, passes, blitzes, man, mofo, withMofoData, disguises;

        static Counts of(List<Play> plays) {
            Counts c = new Counts();
            for (Play p : plays) {
                c.plays++;
                if (!p.isPass()) continue;

                c.passes++;
                if (p.blitz) c.blitzes++;
                if (p.manCoverage) c.man++;
                if (p.mofo) c.mofo++;
                if (p.mofoData) {
                    c.withMofoData++;
                    if (p.disguise) c.disguises++;
                }
            }
            return c;
        }
    }
}
