package com.asad.tendency_analyzer.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * One team's overall metrics in the league-wide comparison table.
 */
public class TeamTendencyRow {

    public String team;
    public int totalPlays;
    public final Map<TendencyMetric, Double> metrics = new EnumMap<>(TendencyMetric.class);

    public TeamTendencyRow() { }

    public TeamTendencyRow(String team, int totalPlays) {
        this.team = team;
        this.totalPlays = totalPlays;
    }

    public Double value(TendencyMetric metric) {
        return metrics.get(metric);
    }
}
