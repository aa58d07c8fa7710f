package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayFilter;
import com.asad.tendency_analyzer.model.PlayRecord;
import com.asad.tendency_analyzer.model.TeamAxis;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.asad.tendency_analyzer.service.TestPlays.derive;
import static com.asad.tendency_analyzer.service.TestPlays.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlayFilterServiceTest {

    private final PlayFilterService filterService = new PlayFilterService();

    private static Play inWeek(String week, int quarter) {
        PlayRecord r = record("R", "PHI", "DAL");
        r.week = week;
        r.quarter = quarter;
        return derive(r);
    }

    @Test
    void weekFilterKeepsOrder() {
        List<Play> plays = List.of(inWeek("3", 1), inWeek("1", 2), inWeek("2", 3), inWeek("1", 4), inWeek("3", 1));

        PlayFilter f = new PlayFilter();
        f.weeks = Set.of("1", "2");

        List<Play> out = filterService.filter(plays, f);
        assertThat(out).extracting(p -> p.week).containsExactly("1", "2", "1");
        assertThat(out).extracting(p -> p.quarter).containsExactly(2, 3, 4);
    }

    @Test
    void emptyFilterKeepsEverythingAndInputIsUntouched() {
        List<Play> plays = new ArrayList<>(List.of(inWeek("1", 1), inWeek("WC", 4)));
        List<Play> before = List.copyOf(plays);

        assertThat(filterService.filter(plays, new PlayFilter())).containsExactlyElementsOf(plays);
        assertThat(filterService.filter(plays, null)).containsExactlyElementsOf(plays);
        assertThat(plays).containsExactlyElementsOf(before);
    }

    @Test
    void teamMatchesTheRequestedSideOfTheBall() {
        Play phiOffense = TestPlays.run("PHI", "DAL");
        Play phiDefense = TestPlays.pass("DAL", "PHI");
        List<Play> plays = List.of(phiOffense, phiDefense);

        PlayFilter f = new PlayFilter("PHI");
        assertThat(filterService.filter(plays, f, TeamAxis.OFFENSE)).containsExactly(phiOffense);
        assertThat(filterService.filter(plays, f, TeamAxis.DEFENSE)).containsExactly(phiDefense);
    }

    @Test
    void criteriaAreAndedTogether() {
        PlayRecord a = record("P", "PHI", "DAL");
        a.down = 3;
        a.distance = 8;
        a.clock = "01:30";
        a.yardsToGoal = 15;
        PlayRecord b = record("P", "PHI", "DAL");
        b.down = 3;
        b.distance = 2;
        b.clock = "01:30";
        b.yardsToGoal = 15;
        PlayRecord c = record("P", "PHI", "DAL");
        c.down = 1;
        c.distance = 10;
        c.clock = "12:00";
        c.yardsToGoal = 80;
        List<Play> plays = List.of(derive(a), derive(b), derive(c));

        PlayFilter f = new PlayFilter("PHI");
        f.downs = Set.of(3);
        f.distance = new PlayFilter.IntRange(7, 10);
        f.minutesRemaining = new PlayFilter.IntRange(0, 2);
        f.yardline = new PlayFilter.IntRange(1, 20);

        assertThat(filterService.filter(plays, f)).extracting(p -> p.distance).containsExactly(8);
    }

    @Test
    void rangesAreInclusive() {
        List<Play> plays = new ArrayList<>();
        for (int ytg = 1; ytg <= 5; ytg++) {
            PlayRecord r = record("R", "PHI", "DAL");
            r.yardsToGoal = ytg;
            plays.add(derive(r));
        }

        PlayFilter f = new PlayFilter();
        f.yardline = new PlayFilter.IntRange(2, 4);
        assertThat(filterService.filter(plays, f)).extracting(p -> p.yardsToGoal).containsExactly(2, 3, 4);
    }

    @Test
    void unknownValuesDropOutOnceTheirCriterionIsSet() {
        PlayRecord r = record("R", "PHI", "DAL");
        r.down = null;
        r.distance = null;
        r.week = null;
        Play unknown = derive(r);
        List<Play> plays = List.of(unknown);

        PlayFilter downs = new PlayFilter();
        downs.downs = Set.of(1, 2);
        assertThat(filterService.filter(plays, downs)).isEmpty();

        PlayFilter weeks = new PlayFilter();
        weeks.weeks = Set.of("1");
        assertThat(filterService.filter(plays, weeks)).isEmpty();

        PlayFilter distance = new PlayFilter();
        distance.distance = new PlayFilter.IntRange(0, 99);
        assertThat(filterService.filter(plays, distance)).isEmpty();

        assertThat(filterService.filter(plays, new PlayFilter())).containsExactly(unknown);
    }

    @Test
    void invertedRangeIsRejected() {
        assertThatThrownBy(() -> new PlayFilter.IntRange(10, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withoutTeamKeepsTheSituation() {
        PlayFilter f = new PlayFilter("PHI");
        f.weeks.add("1");
        f.quarters.add(4);
        f.distance = new PlayFilter.IntRange(1, 3);

        PlayFilter league = f.withoutTeam();
        assertThat(league.team).isNull();
        assertThat(league.weeks).containsExactly("1");
        assertThat(league.quarters).containsExactly(4);
        assertThat(league.distance).isEqualTo(f.distance);
        assertThat(f.team).isEqualTo("PHI");
    }

    @Test
    void againstPersonnelKeepsOneGroup() {
        PlayRecord a = record("P", "DAL", "PHI");
        a.offPersonnel = "11";
        PlayRecord b = record("P", "DAL", "PHI");
        b.offPersonnel = "12";
        List<Play> plays = List.of(derive(a), derive(b));

        assertThat(filterService.againstPersonnel(plays, "12")).extracting(p -> p.offPersonnel).containsExactly("12");
    }
}
