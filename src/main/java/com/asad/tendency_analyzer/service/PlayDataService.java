package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.config.TendencyProperties;
import com.asad.tendency_analyzer.model.FilterOptions;
import com.asad.tendency_analyzer.model.Play;
import com.asad.tendency_analyzer.model.PlayRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Holds the season: loaded, cleaned and derived once on first use, then shared
 * read-only by every view.
 */
@Service
public class PlayDataService {

    private static final Logger log = LoggerFactory.getLogger(PlayDataService.class);

    private final CsvService csvService;
    private final IndicatorService indicatorService;
    private final Path dataPath;

    private volatile List<Play> plays;

    public PlayDataService(CsvService csvService, IndicatorService indicatorService, TendencyProperties properties) {
        this.csvService = csvService;
        this.indicatorService = indicatorService;
        this.dataPath = Paths.get(properties.getDataPath());
    }

    public List<Play> plays() {
        List<Play> cached = plays;
        if (cached != null) return cached;

        synchronized (this) {
            if (plays == null) plays = loadFrom(dataPath);
            return plays;
        }
    }

    /** Re-reads the file; views built before keep their own snapshot. */
    public synchronized List<Play> reload() {
        plays = loadFrom(dataPath);
        return plays;
    }

    List<Play> loadFrom(Path path) {
        long started = System.currentTimeMillis();

        List<PlayRecord> raw = csvService.load(path);
        List<PlayRecord> cleaned = csvService.clean(raw);
        List<Play> derived = indicatorService.derive(cleaned);

        log.info("Loaded {} plays from {} ({} run/pass kept) in {} ms",
                raw.size(), path, derived.size(), System.currentTimeMillis() - started);
        return derived;
    }

    public FilterOptions filterOptions() {
        return filterOptions(plays());
    }

    public static FilterOptions filterOptions(List<Play> plays) {
        TreeSet<String> teams = new TreeSet<>();
        List<String> weeks = new ArrayList<>();
        TreeSet<Integer> quarters = new TreeSet<>();
        TreeSet<Integer> downs = new TreeSet<>();
        TreeSet<String> personnel = new TreeSet<>();

        FilterOptions o = new FilterOptions();
        for (Play p : plays) {
            if (p.offTeam != null) teams.add(p.offTeam);
            if (p.week != null) weeks.add(p.week);
            if (p.quarter != null) quarters.add(p.quarter);
            if (p.down != null) downs.add(p.down);
            if (p.offPersonnel != null) personnel.add(p.offPersonnel);

            o.minMinutes = min(o.minMinutes, p.minutesRemaining);
            o.maxMinutes = max(o.maxMinutes, p.minutesRemaining);
            o.minDistance = min(o.minDistance, p.distance);
            o.maxDistance = max(o.maxDistance, p.distance);
            o.minYardline = min(o.minYardline, p.yardsToGoal);
            o.maxYardline = max(o.maxYardline, p.yardsToGoal);
        }

        o.teams = List.copyOf(teams);
        o.weeks = WeekOrder.sort(weeks);
        o.quarters = List.copyOf(quarters);
        o.downs = List.copyOf(downs);
        o.offPersonnelGroups = List.copyOf(personnel);
        return o;
    }

    private static Integer min(Integer current, Integer v) {
        if (v == null) return current;
        return current == null ? v : Math.min(current, v);
    }

    private static Integer max(Integer current, Integer v) {
        if (v == null) return current;
        return current == null ? v : Math.max(current, v);
    }
}
