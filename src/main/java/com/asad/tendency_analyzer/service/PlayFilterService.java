package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayFilter;
import com.asad.tendency_analyzer.model.TeamAxis;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Applies a {@link PlayFilter}. Input order is kept and the input list is never modified.
 */
@Service
public class PlayFilterService {

    /** Team criterion is matched against the offense. */
    public List<Play> filter(List<Play> plays, PlayFilter filter) {
        return filter(plays, filter, TeamAxis.OFFENSE);
    }

    public List<Play> filter(List<Play> plays, PlayFilter filter, TeamAxis axis) {
        List<Play> out = new ArrayList<>();
        for (Play p : plays) {
            if (matches(p, filter, axis)) out.add(p);
        }
        return Collections.unmodifiableList(out);
    }

    // Set.of() collections reject contains(null), so unknowns are checked first
    public boolean matches(Play p, PlayFilter f, TeamAxis axis) {
        if (f == null) return true;

        if (f.team != null && !f.team.equals(axis.teamOf(p))) return false;

        if (isSet(f.weeks) && (p.week == null || !f.weeks.contains(p.week))) return false;

        if (isSet(f.quarters) && (p.quarter == null || !f.quarters.contains(p.quarter))) return false;

        if (f.minutesRemaining != null && !f.minutesRemaining.contains(p.minutesRemaining)) return false;

        if (isSet(f.downs) && (p.down == null || !f.downs.contains(p.down))) return false;

        if (f.distance != null && !f.distance.contains(p.distance)) return false;

        if (f.yardline != null && !f.yardline.contains(p.yardsToGoal)) return false;

        return true;
    }

    /** Plays run against one offensive personnel group. */
    public List<Play> againstPersonnel(List<Play> plays, String offPersonnel) {
        List<Play> out = new ArrayList<>();
        for (Play p : plays) {
            if (Objects.equals(offPersonnel, p.offPersonnel)) out.add(p);
        }
        return Collections.unmodifiableList(out);
    }

    private static boolean isSet(Set<?> values) {
        return values != null && !values.isEmpty();
    }
}
