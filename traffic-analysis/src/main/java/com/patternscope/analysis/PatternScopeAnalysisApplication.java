package com.patternscope.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
public class PatternScopeAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatternScopeAnalysisApplication.class, args);
    }

}
