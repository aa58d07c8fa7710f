package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.model.DefenseOverall;
import com.asad.tendency_analyzer.model.OffenseOverall;
import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayFilter;
import com.asad.tendency_analyzer.model.TeamAxis;
import com.asad.tendency_analyzer.model.TeamTendencyRow;
import com.asad.tendency_analyzer.model.TendencyMetric;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * League-wide comparison: every team's overall metrics under the same situation,
 * and where one team's value sits among them.
 */
@Service
public class LeagueRankingService {

    public static final String NO_RANK = "-";
    public static final String TIE_PREFIX = "t-";

    private final PlayFilterService filterService;
    private final OffenseTendencyService offenseService;
    private final DefenseTendencyService defenseService;

    public LeagueRankingService(PlayFilterService filterService,
                                OffenseTendencyService offenseService,
                                DefenseTendencyService defenseService) {
        this.filterService = filterService;
        this.offenseService = offenseService;
        this.defenseService = defenseService;
    }

    /**
     * One row per team seen on the given side of the ball, in first-seen order.
     * The filter's team is ignored. Offense rows carry the offensive metrics,
     * defense rows the defensive ones; a defense with no pass plays gets no row.
     */
    public List<TeamTendencyRow> allTeamsOverall(List<Play> plays, PlayFilter situation, TeamAxis axis) {
        PlayFilter anyTeam = (situation == null) ? new PlayFilter() : situation.withoutTeam();
        List<Play> filtered = filterService.filter(plays, anyTeam, axis);

        Map<String, List<Play>> byTeam = new LinkedHashMap<>();
        for (Play p : filtered) {
            String team = axis.teamOf(p);
            if (team == null) continue;
            byTeam.computeIfAbsent(team, k -> new ArrayList<>()).add(p);
        }

        List<TeamTendencyRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<Play>> e : byTeam.entrySet()) {
            List<Play> teamPlays = e.getValue();
            TeamTendencyRow row = new TeamTendencyRow(e.getKey(), teamPlays.size());

            if (axis == TeamAxis.OFFENSE) {
                OffenseOverall o = offenseService.overall(teamPlays);
                for (TendencyMetric m : TendencyMetric.forAxis(axis)) row.metrics.put(m, o.value(m));
            } else {
                DefenseOverall d = defenseService.overall(teamPlays);
                if (d.passPlays == 0) continue;
                for (TendencyMetric m : TendencyMetric.forAxis(axis)) row.metrics.put(m, d.value(m));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Position (1 = highest) of the first entry equal to {@code value} among all
     * teams' values sorted descending, prefixed with "t-" when several teams share
     * it. Equality is exact, so {@code value} has to come from the same computation
     * as the table; a value not in the table ranks as "-".
     */
    public String rank(double value, TendencyMetric metric, List<TeamTendencyRow> table) {
        List<Double> values = new ArrayList<>(table.size());
        for (TeamTendencyRow row : table) {
            Double v = row.value(metric);
            if (v != null) values.add(v);
        }
        values.sort((a, b) -> Double.compare(b, a));

        int position = -1;
        int tied = 0;
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == value) {
                if (position < 0) position = i;
                tied++;
            }
        }

        if (position < 0) return NO_RANK;
        String rank = String.valueOf(position + 1);
        return tied > 1 ? TIE_PREFIX + rank : rank;
    }

    /** Ranks the team's own row of the table; "-" when the team has no row. */
    public String rankTeam(String team, TendencyMetric metric, List<TeamTendencyRow> table) {
        for (TeamTendencyRow row : table) {
            if (row.team.equals(team)) {
                Double v = row.value(metric);
                return v == null ? NO_RANK : rank(v, metric, table);
            }
        }
        return NO_RANK;
    }

    /**
     * "45.2% (12th)", "45.2% (t-12th)" for ties, "45.2%" without a rank and "-"
     * without a value.
     */
    public static String formatWithRank(Double value, String rank) {
        if (value == null || value.isNaN()) return NO_RANK;

        String pct = TendencyMath.formatPct(value) + "%";
        if (rank == null || NO_RANK.equals(rank)) return pct;

        if (rank.startsWith(TIE_PREFIX)) {
            return pct + " (" + rank + "th)";
        }
        return pct + " (" + rank + ordinalSuffix(rank) + ")";
    }

    static String ordinalSuffix(String rank) {
        if (rank.endsWith("1") && !rank.endsWith("11")) return "st";
        if (rank.endsWith("2") && !rank.endsWith("12")) return "nd";
        if (rank.endsWith("3") && !rank.endsWith("13")) return "rd";
        return "th";
    }
}
