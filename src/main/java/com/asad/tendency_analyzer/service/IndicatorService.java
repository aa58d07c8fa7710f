package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Turns cleaned feed rows into {@link Play}s carrying every indicator the
 * aggregations need. Run once per load; the input records are left untouched.
 */
@Service
public class IndicatorService {

    private static final Set<String> STANDARD_DROPBACKS = Set.of("SD", "SR", "SL");

    public List<Play> derive(List<PlayRecord> cleaned) {
        List<Play> plays = new ArrayList<>(cleaned.size());
        for (PlayRecord r : cleaned) {
            plays.add(derive(r));
        }
        return Collections.unmodifiableList(plays);
    }

    public Play derive(PlayRecord r) {
        boolean run = "R".equals(r.runPass);
        boolean motion = r.shiftMotion != null;
        boolean playAction = r.playAction != null && r.playAction != 0;

        // Unknown play action is not a standard dropback
        boolean standardDropback = r.dropbackType != null
                && STANDARD_DROPBACKS.contains(r.dropbackType)
                && r.playAction != null && r.playAction == 0;

        boolean mofoData = r.mofoShown != null && r.mofoPlayed != null;
        boolean disguise = mofoData && !r.mofoShown.equals(r.mofoPlayed);

        return new Play(r,
                PlayFieldParser.parseClockToMinutes(r.clock),
                PlayFieldParser.normalizeFormationGroup(r.offFormation),
                PlayFieldParser.qbAlignment(r.shotgun),
                run,
                motion,
                playAction,
                standardDropback,
                PlayFieldParser.parsePassRushers(r.passRushPlayers),
                r.blitzDog != null && r.blitzDog == 1,
                PlayFieldParser.isManCoverage(r.coverageBasic),
                "O".equals(r.mofoPlayed),
                mofoData,
                disguise,
                PlayFieldParser.normalizeCoverage(r.coverageBasic));
    }
}
