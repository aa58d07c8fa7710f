package com.asad.tendency_analyzer.model;

import java.util.List;

public class OffenseOverall {

    public int totalPlays;
    public double runPct;
    public double paPct;
    public double dbPct;
    public double motionPct;

    // "INSIDE ZONE (32.1%)", share of run plays
    public List<String> topRunConcepts = List.of();

    public OffenseOverall() { }

    public double value(TendencyMetric metric) {
        switch (metric) {
            case RUN_PCT: return runPct;
            case PA_PCT: return paPct;
            case DB_PCT: return dbPct;
            case MOTION_PCT: return motionPct;
            default: throw new IllegalArgumentException("Not an offensive metric: " + metric);
        }
    }
}
