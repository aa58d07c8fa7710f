package com.asad.tendency_analyzer.model;

/**
 * A cleaned run/pass play with every indicator the aggregations read.
 * Built once by the indicator pass and never changed afterwards.
 */
public final class Play {

    // Raw context
    public final String runPass;
    public final String offTeam;
    public final String defTeam;
    public final String week;
    public final Integer quarter;
    public final Integer down;
    public final Integer distance;
    public final Integer yardsToGoal;
    public final String clock;

    public final String runConcept;
    public final String dropbackType;
    public final Integer playAction;
    public final String offPersonnel;
    public final String offFormation;
    public final String shotgun;
    public final String shiftMotion;

    public final String defPackage;
    public final Integer blitzDog;
    public final String passRushPlayers;
    public final String coverageBasic;
    public final String mofoShown;
    public final String mofoPlayed;

    // Derived
    public final int minutesRemaining;
    public final String formationGroup;     // larger side first, "1x3" -> "3x1"
    public final String qbAlignment;        // Shotgun / Under Center
    public final boolean run;
    public final boolean motion;
    public final boolean playActionPass;
    public final boolean standardDropback;

    public final int passRushers;
    public final boolean blitz;
    public final boolean manCoverage;
    public final boolean mofo;
    public final boolean mofoData;          // both shown and played known
    public final boolean disguise;          // only meaningful when mofoData
    public final String coverage;           // Cover 3 variants collapsed

    public Play(PlayRecord raw,
                int minutesRemaining, String formationGroup, String qbAlignment,
                boolean run, boolean motion, boolean playActionPass, boolean standardDropback,
                int passRushers, boolean blitz, boolean manCoverage,
                boolean mofo, boolean mofoData, boolean disguise, String coverage) {
        this.runPass = raw.runPass;
        this.offTeam = raw.offTeam;
        this.defTeam = raw.defTeam;
        this.week = raw.week;
        this.quarter = raw.quarter;
        this.down = raw.down;
        this.distance = raw.distance;
        this.yardsToGoal = raw.yardsToGoal;
        this.clock = raw.clock;
        this.runConcept = raw.runConcept;
        this.dropbackType = raw.dropbackType;
        this.playAction = raw.playAction;
        this.offPersonnel = raw.offPersonnel;
        this.offFormation = raw.offFormation;
        this.shotgun = raw.shotgun;
        this.shiftMotion = raw.shiftMotion;
        this.defPackage = raw.defPackage;
        this.blitzDog = raw.blitzDog;
        this.passRushPlayers = raw.passRushPlayers;
        this.coverageBasic = raw.coverageBasic;
        this.mofoShown = raw.mofoShown;
        this.mofoPlayed = raw.mofoPlayed;

        this.minutesRemaining = minutesRemaining;
        this.formationGroup = formationGroup;
        this.qbAlignment = qbAlignment;
        this.run = run;
        this.motion = motion;
        this.playActionPass = playActionPass;
        this.standardDropback = standardDropback;
        this.passRushers = passRushers;
        this.blitz = blitz;
        this.manCoverage = manCoverage;
        this.mofo = mofo;
        this.mofoData = mofoData;
        this.disguise = disguise;
        this.coverage = coverage;
    }

    public boolean isPass() {
        return "P".equals(runPass);
    }
}
