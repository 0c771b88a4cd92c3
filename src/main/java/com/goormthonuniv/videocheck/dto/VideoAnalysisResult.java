package com.goormthonuniv.videocheck.dto;

public record VideoAnalysisResult(
        AnalyzerResult aiGenerated,
        AnalyzerResult manipulation,
        AnalyzerResult authenticity,
        OverallVerdict overall,
        AuthenticityReport authenticityReport
) {}
