package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.config.TendencyProperties;
import com.asad.tendency_analyzer.model.OffenseCategoryRow;
import com.asad.tendency_analyzer.model.OffenseOverall;
import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayCategory;
import com.asad.tendency_analyzer.model.PlayRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.asad.tendency_analyzer.service.TestPlays.derive;
import static com.asad.tendency_analyzer.service.TestPlays.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OffenseTendencyServiceTest {

    private final OffenseTendencyService service = new OffenseTendencyService(new TendencyProperties());

    private static Play run(String concept, String personnel) {
        PlayRecord r = record("R", "PHI", "DAL");
        r.runConcept = concept;
        r.offPersonnel = personnel;
        return derive(r);
    }

    private static Play pass(String personnel, String dropback, int playAction, String motion) {
        PlayRecord r = record("P", "PHI", "DAL");
        r.offPersonnel = personnel;
        r.dropbackType = dropback;
        r.playAction = playAction;
        r.shiftMotion = motion;
        return derive(r);
    }

    /** 6 runs and 4 passes: 1 play action, 2 straight dropbacks, 2 motions. */
    private static List<Play> tenPlays() {
        List<Play> plays = new ArrayList<>();
        plays.add(run("INSIDE ZONE", "11"));
        plays.add(run("OUTSIDE ZONE", "11"));
        plays.add(run("INSIDE ZONE", "12"));
        plays.add(run("OUTSIDE ZONE", "12"));
        plays.add(run("POWER", "12"));
        plays.add(run("COUNTER", "11"));
        plays.add(pass("11", "SD", 0, "JET"));
        plays.add(pass("11", "SL", 0, null));
        plays.add(pass("11", "SD", 1, "ORBIT"));
        plays.add(pass("11", "RL", 0, null));
        return plays;
    }

    @Test
    void emptyInputIsAllZeros() {
        OffenseOverall o = service.overall(List.of());
        assertThat(o.totalPlays).isZero();
        assertThat(o.runPct).isZero();
        assertThat(o.paPct).isZero();
        assertThat(o.dbPct).isZero();
        assertThat(o.motionPct).isZero();
        assertThat(o.topRunConcepts).isEmpty();

        assertThat(service.byCategory(List.of(), PlayCategory.PERSONNEL)).isEmpty();
    }

    @Test
    void overallRatesUseAllPlays() {
        OffenseOverall o = service.overall(tenPlays());

        assertThat(o.totalPlays).isEqualTo(10);
        assertThat(o.runPct).isEqualTo(60.0);
        assertThat(o.paPct).isCloseTo(10.0, within(1e-9));
        assertThat(o.dbPct).isCloseTo(20.0, within(1e-9));
        assertThat(o.motionPct).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void topRunConceptsAreSharesOfRunPlays() {
        OffenseOverall o = service.overall(tenPlays());

        // equal counts keep first-seen order
        assertThat(o.topRunConcepts).containsExactly(
                "INSIDE ZONE (33.3%)", "OUTSIDE ZONE (33.3%)", "POWER (16.7%)");
    }

    @Test
    void runPlaysWithoutConceptStillCountInTheDenominator() {
        List<Play> plays = List.of(run("POWER", "11"), run(null, "11"), run(null, "11"), run("POWER", "11"));
        assertThat(service.overall(plays).topRunConcepts).containsExactly("POWER (50.0%)");
    }

    @Test
    void noRunPlaysMeansNoConcepts() {
        assertThat(service.overall(List.of(pass("11", "SD", 0, null))).topRunConcepts).isEmpty();
    }

    @Test
    void categoryRatesUseTheCategorysOwnPlays() {
        List<OffenseCategoryRow> rows = service.byCategory(tenPlays(), PlayCategory.PERSONNEL);

        assertThat(rows).extracting(r -> r.category).containsExactly("11", "12");

        OffenseCategoryRow eleven = rows.get(0);
        assertThat(eleven.plays).isEqualTo(7);
        assertThat(eleven.usagePct).isCloseTo(70.0, within(1e-9));
        assertThat(eleven.runPct).isCloseTo(300.0 / 7, within(1e-9));
        assertThat(eleven.paPct).isCloseTo(100.0 / 7, within(1e-9));
        assertThat(eleven.topRunConcepts).isEqualTo("INSIDE ZONE (33.3%)\nOUTSIDE ZONE (33.3%)\nCOUNTER (33.3%)");

        OffenseCategoryRow twelve = rows.get(1);
        assertThat(twelve.plays).isEqualTo(3);
        assertThat(twelve.usagePct).isCloseTo(30.0, within(1e-9));
        assertThat(twelve.runPct).isEqualTo(100.0);
        assertThat(twelve.dbPct).isZero();
    }

    @Test
    void usageSumsToOneHundredWhenEveryPlayHasACategory() {
        List<OffenseCategoryRow> rows = service.byCategory(tenPlays(), PlayCategory.QB_ALIGNMENT);
        double sum = rows.stream().mapToDouble(r -> r.usagePct).sum();
        assertThat(sum).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void playsWithoutCategoryAreLeftOut() {
        List<Play> plays = new ArrayList<>(tenPlays());
        plays.add(run("POWER", null));

        List<OffenseCategoryRow> rows = service.byCategory(plays, PlayCategory.PERSONNEL);
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).usagePct).isCloseTo(700.0 / 11, within(1e-9));
    }

    @Test
    void equalUsageIsOrderedByCategory() {
        List<Play> plays = List.of(run("POWER", "21"), run("POWER", "12"), run("POWER", "11"), run("POWER", "11"));

        List<OffenseCategoryRow> rows = service.byCategory(plays, PlayCategory.PERSONNEL);
        assertThat(rows).extracting(r -> r.category).containsExactly("11", "12", "21");
    }

    @Test
    void formationsAreGroupedByNormalizedShape() {
        PlayRecord a = record("P", "PHI", "DAL");
        a.offFormation = "1x3";
        PlayRecord b = record("P", "PHI", "DAL");
        b.offFormation = "3x1";
        PlayRecord c = record("R", "PHI", "DAL");
        c.offFormation = "2x2";

        List<OffenseCategoryRow> rows = service.byCategory(List.of(derive(a), derive(b), derive(c)), PlayCategory.FORMATION);
        assertThat(rows).extracting(r -> r.category).containsExactly("3x1", "2x2");
        assertThat(rows.get(0).plays).isEqualTo(2);
        assertThat(rows.get(0).topRunConcepts).isEmpty();
    }
}
