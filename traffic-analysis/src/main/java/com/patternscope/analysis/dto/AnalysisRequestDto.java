package com.patternscope.analysis.dto;

import lombok.Data;

import java.util.List;

@Data
public class AnalysisRequestDto {
    private String start;
    private String end;
    private List<String> methods;
    private Long seed;
}
