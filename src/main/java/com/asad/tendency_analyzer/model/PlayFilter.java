package com.asad.tendency_analyzer.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Situational filter for a view. Null or empty criteria don't constrain anything;
 * everything that is set has to match.
 */
public class PlayFilter {

    public String team;                                 // null = all teams
    public Set<String> weeks = new LinkedHashSet<>();
    public Set<Integer> quarters = new LinkedHashSet<>();
    public IntRange minutesRemaining;                   // inclusive
    public Set<Integer> downs = new LinkedHashSet<>();
    public IntRange distance;                           // inclusive
    public IntRange yardline;                           // inclusive, yards to goal

    public PlayFilter() { }

    public PlayFilter(String team) {
        this.team = team;
    }

    /** Same situation, any team. Used for league-wide comparisons. */
    public PlayFilter withoutTeam() {
        PlayFilter copy = new PlayFilter(null);
        copy.weeks = new LinkedHashSet<>(weeks);
        copy.quarters = new LinkedHashSet<>(quarters);
        copy.minutesRemaining = minutesRemaining;
        copy.downs = new LinkedHashSet<>(downs);
        copy.distance = distance;
        copy.yardline = yardline;
        return copy;
    }

    public record IntRange(int min, int max) {

        public IntRange {
            if (min > max) {
                throw new IllegalArgumentException("Range min " + min + " is greater than max " + max);
            }
        }

        /** Unknown values never fall inside a range. */
        public boolean contains(Integer value) {
            return value != null && value >= min && value <= max;
        }
    }
}
