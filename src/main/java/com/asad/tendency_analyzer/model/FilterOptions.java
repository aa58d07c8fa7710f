package com.asad.tendency_analyzer.model;

import java.util.List;

/**
 * Values a caller can choose from, taken from the loaded season.
 */
public class FilterOptions {

    public List<String> teams = List.of();
    public List<String> weeks = List.of();      // 1..18 then WC, DP, CC, SB
    public List<Integer> quarters = List.of();
    public List<Integer> downs = List.of();
    public List<String> offPersonnelGroups = List.of();

    public Integer minMinutes;
    public Integer maxMinutes;
    public Integer minDistance;
    public Integer maxDistance;
    public Integer minYardline;
    public Integer maxYardline;

    public FilterOptions() { }
}
