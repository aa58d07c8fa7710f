package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.config.TendencyProperties;
import com.asad.tendency_analyzer.model.DefenseReport;
import com.asad.tendency_analyzer.model.OffenseReport;
import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayCategory;
import com.asad.tendency_analyzer.model.PlayFilter;
import com.asad.tendency_analyzer.model.TeamAxis;
import com.asad.tendency_analyzer.model.TeamTendencyRow;
import com.asad.tendency_analyzer.model.TendencyMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;

/**
 * Puts together the offense and defense views for one team: overall numbers
 * ranked against the league under the same situation, plus the category tables.
 */
@Service
public class TendencyReportService {

    private static final Logger log = LoggerFactory.getLogger(TendencyReportService.class);

    private final PlayFilterService filterService;
    private final OffenseTendencyService offenseService;
    private final DefenseTendencyService defenseService;
    private final LeagueRankingService rankingService;
    private final String defaultVsPersonnel;

    public TendencyReportService(PlayFilterService filterService,
                                 OffenseTendencyService offenseService,
                                 DefenseTendencyService defenseService,
                                 LeagueRankingService rankingService,
                                 TendencyProperties properties) {
        this.filterService = filterService;
        this.offenseService = offenseService;
        this.defenseService = defenseService;
        this.rankingService = rankingService;
        this.defaultVsPersonnel = properties.getDefaultVsPersonnel();
    }

    public OffenseReport offense(List<Play> season, PlayFilter filter) {
        List<Play> view = filterService.filter(season, filter, TeamAxis.OFFENSE);
        log.debug("Offense view for {}: {} of {} plays", filter.team, view.size(), season.size());

        OffenseReport report = new OffenseReport(filter.team);
        report.overall = offenseService.overall(view);

        List<TeamTendencyRow> league = rankingService.allTeamsOverall(season, filter, TeamAxis.OFFENSE);
        addRanks(report.ranks, report.display, filter.team, TeamAxis.OFFENSE, league,
                m -> report.overall.value(m));

        report.personnel = offenseService.byCategory(view, PlayCategory.PERSONNEL);
        report.formations = offenseService.byCategory(view, PlayCategory.FORMATION);
        report.qbAlignment = offenseService.byCategory(view, PlayCategory.QB_ALIGNMENT);
        return report;
    }

    /**
     * @param vsPersonnel offensive personnel group for the "packages vs personnel"
     *                    table; null picks the configured default when it was faced,
     *                    otherwise the first group faced
     */
    public DefenseReport defense(List<Play> season, PlayFilter filter, String vsPersonnel) {
        List<Play> view = filterService.filter(season, filter, TeamAxis.DEFENSE);
        log.debug("Defense view for {}: {} of {} plays", filter.team, view.size(), season.size());

        DefenseReport report = new DefenseReport(filter.team);
        report.overall = defenseService.overall(view);

        List<TeamTendencyRow> league = rankingService.allTeamsOverall(season, filter, TeamAxis.DEFENSE);
        addRanks(report.ranks, report.display, filter.team, TeamAxis.DEFENSE, league,
                m -> report.overall.value(m));

        report.packages = defenseService.byCategory(view, PlayCategory.DEF_PACKAGE);

        TreeSet<String> faced = new TreeSet<>();
        for (Play p : view) {
            if (p.offPersonnel != null) faced.add(p.offPersonnel);
        }
        report.personnelOptions = List.copyOf(faced);

        String personnel = vsPersonnel;
        if (personnel == null && !faced.isEmpty()) {
            personnel = faced.contains(defaultVsPersonnel) ? defaultVsPersonnel : faced.first();
        }
        report.vsPersonnel = personnel;
        if (personnel != null) {
            List<Play> against = filterService.againstPersonnel(view, personnel);
            report.packagesVsPersonnel = defenseService.byCategory(against, PlayCategory.DEF_PACKAGE);
        }
        return report;
    }

    // The ranked value is the team's own row of the league table, so exact matching holds
    private void addRanks(Map<String, String> ranks, Map<String, String> display,
                          String team, TeamAxis axis, List<TeamTendencyRow> league,
                          ToDoubleFunction<TendencyMetric> viewValue) {
        boolean ranked = team != null && league.stream().anyMatch(r -> r.team.equals(team));
        if (team != null && !ranked) {
            log.warn("{} has no {} row in the league table for this situation", team, axis.name().toLowerCase(Locale.ROOT));
        }

        for (TendencyMetric m : TendencyMetric.forAxis(axis)) {
            String rank = ranked ? rankingService.rankTeam(team, m, league) : LeagueRankingService.NO_RANK;
            ranks.put(m.label(), rank);
            display.put(m.label(), LeagueRankingService.formatWithRank(viewValue.applyAsDouble(m), rank));
        }
    }
}
