package com.asad.tendency_analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tendency", ignoreUnknownFields = false)
public class TendencyProperties {

    private String dataPath = "Data/PFF_2025_FULL_Play_Feed.csv";

    // Entries in the top run concept / top coverage lists
    private int topEntries = 3;

    private String defaultVsPersonnel = "11";

    public String getDataPath() {
        return dataPath;
    }

    public void setDataPath(String dataPath) {
        this.dataPath = dataPath;
    }

    public int getTopEntries() {
        return topEntries;
    }

    public void setTopEntries(int topEntries) {
        this.topEntries = topEntries;
    }

    public String getDefaultVsPersonnel() {
        return defaultVsPersonnel;
    }

    public void setDefaultVsPersonnel(String defaultVsPersonnel) {
        this.defaultVsPersonnel = defaultVsPersonnel;
    }
}
