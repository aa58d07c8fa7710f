package com.asad.tendency_analyzer.web;

import com.asad.tendency_analyzer.model.DefenseReport;
import com.asad.tendency_analyzer.model.FilterOptions;
import com.asad.tendency_analyzer.model.OffenseReport;
import com.asad.tendency_analyzer.model.PlayFilter;
import com.asad.tendency_analyzer.service.PlayDataException;
import com.asad.tendency_analyzer.service.PlayDataService;
import com.asad.tendency_analyzer.service.TendencyReportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Controller
public class TendencyController {

    private static final Logger log = LoggerFactory.getLogger(TendencyController.class);

    private final PlayDataService playDataService;
    private final TendencyReportService reportService;

    public TendencyController(PlayDataService playDataService, TendencyReportService reportService) {
        this.playDataService = playDataService;
        this.reportService = reportService;
    }

    @GetMapping(value = "/tendencies/filters", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public FilterOptions filters() {
        return playDataService.filterOptions();
    }

    @GetMapping(value = "/tendencies/offense", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public OffenseReport offense(@RequestParam String team,
                                 @RequestParam(required = false) List<String> weeks,
                                 @RequestParam(required = false) List<Integer> quarters,
                                 @RequestParam(required = false) Integer minMinutes,
                                 @RequestParam(required = false) Integer maxMinutes,
                                 @RequestParam(required = false) List<Integer> downs,
                                 @RequestParam(required = false) Integer minDistance,
                                 @RequestParam(required = false) Integer maxDistance,
                                 @RequestParam(required = false) Integer minYardline,
                                 @RequestParam(required = false) Integer maxYardline) {

        PlayFilter filter = buildFilter(team, weeks, quarters, minMinutes, maxMinutes,
                downs, minDistance, maxDistance, minYardline, maxYardline);
        return reportService.offense(playDataService.plays(), filter);
    }

    @GetMapping(value = "/tendencies/defense", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public DefenseReport defense(@RequestParam String team,
                                 @RequestParam(required = false) List<String> weeks,
                                 @RequestParam(required = false) List<Integer> quarters,
                                 @RequestParam(required = false) Integer minMinutes,
                                 @RequestParam(required = false) Integer maxMinutes,
                                 @RequestParam(required = false) List<Integer> downs,
                                 @RequestParam(required = false) Integer minDistance,
                                 @RequestParam(required = false) Integer maxDistance,
                                 @RequestParam(required = false) Integer minYardline,
                                 @RequestParam(required = false) Integer maxYardline,
                                 @RequestParam(required = false) String vsPersonnel) {

        PlayFilter filter = buildFilter(team, weeks, quarters, minMinutes, maxMinutes,
                downs, minDistance, maxDistance, minYardline, maxYardline);

        String personnel = (vsPersonnel == null || vsPersonnel.isBlank()) ? null : vsPersonnel.trim();
        return reportService.defense(playDataService.plays(), filter, personnel);
    }

    static PlayFilter buildFilter(String team,
                                  List<String> weeks, List<Integer> quarters,
                                  Integer minMinutes, Integer maxMinutes,
                                  List<Integer> downs,
                                  Integer minDistance, Integer maxDistance,
                                  Integer minYardline, Integer maxYardline) {

        String t = (team == null || team.isBlank()) ? null : team.trim();
        PlayFilter f = new PlayFilter(t);

        if (weeks != null) {
            for (String w : weeks) {
                if (w != null && !w.isBlank()) f.weeks.add(w.trim());
            }
        }
        if (quarters != null) f.quarters = new LinkedHashSet<>(quarters);
        if (downs != null) f.downs = new LinkedHashSet<>(downs);

        f.minutesRemaining = range(minMinutes, maxMinutes);
        f.distance = range(minDistance, maxDistance);
        f.yardline = range(minYardline, maxYardline);
        return f;
    }

    // Only one end given: the other one is open
    private static PlayFilter.IntRange range(Integer min, Integer max) {
        if (min == null && max == null) return null;
        return new PlayFilter.IntRange(
                min == null ? Integer.MIN_VALUE : min,
                max == null ? Integer.MAX_VALUE : max);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(PlayDataException.class)
    public ResponseEntity<Map<String, String>> dataUnavailable(PlayDataException ex) {
        log.error("Play data unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", ex.getMessage()));
    }
}
