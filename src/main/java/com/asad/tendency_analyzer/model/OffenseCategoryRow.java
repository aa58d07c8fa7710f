package com.asad.tendency_analyzer.model;

public class OffenseCategoryRow {

    public String category;
    public int plays;
    public double usagePct;     // share of all plays in the view

    // Denominated by this category's plays
    public double runPct;
    public double paPct;
    public double dbPct;
    public double motionPct;

    // Up to three entries separated by '\n'
    public String topRunConcepts = "";

    public OffenseCategoryRow() { }

    public OffenseCategoryRow(String category, int plays) {
        this.category = category;
        this.plays = plays;
    }
}
