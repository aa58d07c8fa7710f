package com.asad.tendency_analyzer.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class OffenseReport {

    public String team;
    public OffenseOverall overall;

    // metric label -> "3", "t-7" or "-"
    public Map<String, String> ranks = new LinkedHashMap<>();
    // metric label -> "45.2% (3rd)"
    public Map<String, String> display = new LinkedHashMap<>();

    public List<OffenseCategoryRow> personnel = List.of();
    public List<OffenseCategoryRow> formations = List.of();
    public List<OffenseCategoryRow> qbAlignment = List.of();

    public OffenseReport() { }

    public OffenseReport(String team) {
        this.team = team;
    }
}
