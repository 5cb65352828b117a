package org.carball.advisor.knowledge;

public record IndicatorMatch(String patternName, double score) {}
