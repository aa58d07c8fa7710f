package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.config.TendencyProperties;
import com.asad.tendency_analyzer.model.OffenseCategoryRow;
import com.asad.tendency_analyzer.model.OffenseOverall;
import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayCategory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offensive tendencies: how often a team runs, uses play action, drops back
 * and motions, overall and per personnel / formation / QB alignment.
 */
@Service
public class OffenseTendencyService {

    static final Comparator<OffenseCategoryRow> BY_USAGE =
            Comparator.comparingDouble((OffenseCategoryRow r) -> r.usagePct).reversed()
                    .thenComparing(r -> r.category);

    private final int topEntries;

    public OffenseTendencyService(TendencyProperties properties) {
        this.topEntries = properties.getTopEntries();
    }

    /** Empty input gives zero plays and zero percentages. */
    public OffenseOverall overall(List<Play> plays) {
        OffenseOverall o = new OffenseOverall();
        o.totalPlays = plays.size();
        if (o.totalPlays == 0) return o;

        Counts c = Counts.of(plays);
        o.runPct = TendencyMath.pct(c.runs, c.plays);
        o.paPct = TendencyMath.pct(c.playAction, c.plays);
        o.dbPct = TendencyMath.pct(c.dropbacks, c.plays);
        o.motionPct = TendencyMath.pct(c.motion, c.plays);
        o.topRunConcepts = topRunConcepts(plays, c.runs);
        return o;
    }

    /**
     * One row per category value present, most used first (ties by category name).
     * Plays without a value for the category are left out.
     */
    public List<OffenseCategoryRow> byCategory(List<Play> plays, PlayCategory category) {
        if (plays.isEmpty()) return List.of();

        int total = plays.size();
        Map<String, List<Play>> groups = new LinkedHashMap<>();
        for (Play p : plays) {
            String key = category.keyOf(p);
            if (key == null) continue;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }

        List<OffenseCategoryRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<Play>> g : groups.entrySet()) {
            List<Play> group = g.getValue();
            Counts c = Counts.of(group);

            OffenseCategoryRow row = new OffenseCategoryRow(g.getKey(), c.plays);
            row.usagePct = TendencyMath.pct(c.plays, total);
            row.runPct = TendencyMath.pct(c.runs, c.plays);
            row.paPct = TendencyMath.pct(c.playAction, c.plays);
            row.dbPct = TendencyMath.pct(c.dropbacks, c.plays);
            row.motionPct = TendencyMath.pct(c.motion, c.plays);
            row.topRunConcepts = String.join("\n", topRunConcepts(group, c.runs));
            rows.add(row);
        }

        rows.sort(BY_USAGE);
        return rows;
    }

    // Share of run plays, not of all plays
    private List<String> topRunConcepts(List<Play> plays, int runs) {
        if (runs == 0) return List.of();
        List<String> concepts = new ArrayList<>(runs);
        for (Play p : plays) {
            if (p.run) concepts.add(p.runConcept);
        }
        return TendencyMath.topValues(concepts, runs, topEntries);
    }

    private static final class Counts {
        int plays, runs, playAction, dropbacks, motion;

        static Counts of(List<Play> plays) {
            Counts c = new Counts();
            for (Play p : plays) {
                c.plays++;
                if (p.run) c.runs++;
                if (p.playActionPass) c.playAction++;
                if (p.standardDropback) c.dropbacks++;
                if (p.motion) c.motion++;
            }
            return c;
        }
    }
}
