package com.asad.tendency_analyzer.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlayFieldParserTest {

    @Test
    void clockGivesWholeMinutesLeft() {
        assertThat(PlayFieldParser.parseClockToMinutes("14:53")).isEqualTo(14);
        assertThat(PlayFieldParser.parseClockToMinutes("00:59")).isEqualTo(0);
        assertThat(PlayFieldParser.parseClockToMinutes("7:30")).isEqualTo(7);
    }

    @Test
    void unreadableClockFallsBackToZero() {
        assertThat(PlayFieldParser.parseClockToMinutes(null)).isZero();
        assertThat(PlayFieldParser.parseClockToMinutes("")).isZero();
        assertThat(PlayFieldParser.parseClockToMinutes("bad")).isZero();
        assertThat(PlayFieldParser.parseClockToMinutes(":30")).isZero();
        assertThat(PlayFieldParser.parseClockToMinutes(":")).isZero();
        assertThat(PlayFieldParser.parseClockToMinutes("::")).isZero();
    }

    @Test
    void passRushersReadFromLeadingCount() {
        assertThat(PlayFieldParser.parsePassRushers("4; PHI 53 (LILB); PHI 90 (NRT)")).isEqualTo(4);
        assertThat(PlayFieldParser.parsePassRushers(" 6 ")).isEqualTo(6);
        assertThat(PlayFieldParser.parsePassRushers(null)).isZero();
        assertThat(PlayFieldParser.parsePassRushers("PHI 53; 4")).isZero();
        assertThat(PlayFieldParser.parsePassRushers(";")).isZero();
        assertThat(PlayFieldParser.parsePassRushers(";;")).isZero();
    }

    @Test
    void formationGroupPutsLargerSideFirst() {
        assertThat(PlayFieldParser.normalizeFormationGroup("1x3")).isEqualTo("3x1");
        assertThat(PlayFieldParser.normalizeFormationGroup("3x1")).isEqualTo("3x1");
        assertThat(PlayFieldParser.normalizeFormationGroup("2x2")).isEqualTo("2x2");
        assertThat(PlayFieldParser.normalizeFormationGroup("1x2")).isEqualTo("2x1");
    }

    @Test
    void formationGroupLeavesOtherShapesAlone() {
        assertThat(PlayFieldParser.normalizeFormationGroup(null)).isNull();
        assertThat(PlayFieldParser.normalizeFormationGroup("EMPTY")).isEqualTo("EMPTY");
        assertThat(PlayFieldParser.normalizeFormationGroup("Ax3")).isEqualTo("Ax3");
        assertThat(PlayFieldParser.normalizeFormationGroup("1x2x3")).isEqualTo("1x2x3");
    }

    @Test
    void coverageVariantsCollapse() {
        assertThat(PlayFieldParser.normalizeCoverage("Cover 3 Seam")).isEqualTo("COVER 3");
        assertThat(PlayFieldParser.normalizeCoverage(" cover 3 cloud ")).isEqualTo("COVER 3");
        assertThat(PlayFieldParser.normalizeCoverage("COVER 3 DBL CLOUD")).isEqualTo("COVER 3");
        assertThat(PlayFieldParser.normalizeCoverage("Cover 2")).isEqualTo("COVER 2");
        assertThat(PlayFieldParser.normalizeCoverage(null)).isNull();
    }

    @Test
    void manCoverageIsExactlyTheFourManLooks() {
        assertThat(PlayFieldParser.isManCoverage("cover 0")).isTrue();
        assertThat(PlayFieldParser.isManCoverage("Cover 1")).isTrue();
        assertThat(PlayFieldParser.isManCoverage(" COVER 1 DOUBLE ")).isTrue();
        assertThat(PlayFieldParser.isManCoverage("Cover 2 Man")).isTrue();

        assertThat(PlayFieldParser.isManCoverage("Cover 2")).isFalse();
        assertThat(PlayFieldParser.isManCoverage("Cover 3 Seam")).isFalse();
        assertThat(PlayFieldParser.isManCoverage(null)).isFalse();
    }

    @Test
    void shotgunCodeDecidesQbAlignment() {
        assertThat(PlayFieldParser.qbAlignment("S")).isEqualTo("Shotgun");
        assertThat(PlayFieldParser.qbAlignment("U")).isEqualTo("Under Center");
        assertThat(PlayFieldParser.qbAlignment(null)).isEqualTo("Under Center");
    }
}
