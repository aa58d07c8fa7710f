package com.asad.tendency_analyzer.model;

/**
 * One raw row of the play feed, as read from the CSV.
 * Blank cells are null; nothing here is derived yet.
 */
public class PlayRecord {

    public String runPass;          // R / P / anything else (special teams, kneel, spike...)
    public String offTeam;
    public String defTeam;
    public String week;             // "1".."18" or WC / DP / CC / SB

    public Integer quarter;
    public Integer down;
    public Integer distance;        // yards to go
    public Integer yardsToGoal;
    public String clock;            // "MM:SS" left in the quarter

    public String runConcept;
    public String dropbackType;
    public Integer playAction;      // 0/1

    public String offPersonnel;     // e.g. "11"
    public String offFormation;     // e.g. "1x3"
    public String shotgun;          // 'S' = shotgun
    public String shiftMotion;      // presence matters, not the value

    public String defPackage;
    public Integer blitzDog;        // 0/1
    public String passRushPlayers;  // "4; PHI 53 (LILB); PHI 90 (NRT); ..."
    public String coverageBasic;
    public String mofoShown;        // O / C
    public String mofoPlayed;       // O / C

    public PlayRecord() { }

    public PlayRecord(String runPass, String offTeam, String defTeam, String week) {
        this.runPass = runPass;
        this.offTeam = offTeam;
        this.defTeam = defTeam;
        this.week = week;
    }

    public boolean isRunOrPass() {
        return "R".equals(runPass) || "P".equals(runPass);
    }
}
