package com.asad.tendency_analyzer.model;

import java.util.List;

public class DefenseOverall {

    public int totalPlays;
    public int passPlays;

    // Against pass plays only
    public double blitzPct;
    public double manPct;
    public double mofoPct;

    // Against pass plays with both MOFO looks charted
    public double disguisePct;

    public List<String> topCoverages = List.of();

    public DefenseOverall() { }

    public double value(TendencyMetric metric) {
        switch (metric) {
            case BLITZ_PCT: return blitzPct;
            case MAN_PCT: return manPct;
            case MOFO_PCT: return mofoPct;
            case DISGUISE_PCT: return disguisePct;
            default: throw new IllegalArgumentException("Not a defensive metric: " + metric);
        }
    }
}
