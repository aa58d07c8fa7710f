package com.asad.tendency_analyzer.model;

import java.util.function.Function;

/**
 * Which side of the ball a team filter or league grouping looks at.
 */
public enum TeamAxis {

    OFFENSE(p -> p.offTeam),
    DEFENSE(p -> p.defTeam);

    private final Function<Play, String> team;

    TeamAxis(Function<Play, String> team) {
        this.team = team;
    }

    public String teamOf(Play play) {
        return team.apply(play);
    }
}
