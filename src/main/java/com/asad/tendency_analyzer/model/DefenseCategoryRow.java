package com.asad.tendency_analyzer.model;

public class DefenseCategoryRow {

    public String category;
    public int plays;
    public int passPlays;
    public double usagePct;

    public double blitzPct;
    public double manPct;
    public double mofoPct;
    public double disguisePct;

    public String topCoverages = "";

    public DefenseCategoryRow() { }

    public DefenseCategoryRow(String category, int plays) {
        this.category = category;
        this.plays = plays;
    }
}
