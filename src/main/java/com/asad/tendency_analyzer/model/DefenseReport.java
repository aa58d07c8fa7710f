package com.asad.tendency_analyzer.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DefenseReport {

    public String team;
    public DefenseOverall overall;

    public Map<String, String> ranks = new LinkedHashMap<>();
    public Map<String, String> display = new LinkedHashMap<>();

    public List<DefenseCategoryRow> packages = List.of();

    // Packages used against one offensive personnel group
    public String vsPersonnel;
    public List<String> personnelOptions = List.of();
    public List<DefenseCategoryRow> packagesVsPersonnel = List.of();

    public DefenseReport() { }

    public DefenseReport(String team) {
        this.team = team;
    }
}
