package com.asad.tendency_analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TendencyAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TendencyAnalyzerApplication.class, args);
    }
}
