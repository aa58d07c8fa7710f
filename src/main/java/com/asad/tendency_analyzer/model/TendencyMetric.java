package com.asad.tendency_analyzer.model;

import java.util.Arrays;

/**
 * Overall metrics that can be ranked across the league.
 */
public enum TendencyMetric {

    RUN_PCT("Run_Pct", TeamAxis.OFFENSE),
    PA_PCT("PA_Pct", TeamAxis.OFFENSE),
    DB_PCT("DB_Pct", TeamAxis.OFFENSE),
    MOTION_PCT("Motion_Pct", TeamAxis.OFFENSE),

    BLITZ_PCT("Blitz_Pct", TeamAxis.DEFENSE),
    MAN_PCT("Man_Pct", TeamAxis.DEFENSE),
    MOFO_PCT("MOFO_Pct", TeamAxis.DEFENSE),
    DISGUISE_PCT("Disguise_Pct", TeamAxis.DEFENSE);

    private final String label;
    private final TeamAxis axis;

    TendencyMetric(String label, TeamAxis axis) {
        this.label = label;
        this.axis = axis;
    }

    public String label() {
        return label;
    }

    public TeamAxis axis() {
        return axis;
    }

    public static TendencyMetric[] forAxis(TeamAxis axis) {
        return Arrays.stream(values())
                .filter(m -> m.axis == axis)
                .toArray(TendencyMetric[]::new);
    }
}
