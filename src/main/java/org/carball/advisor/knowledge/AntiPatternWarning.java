package org.carball.advisor.knowledge;

public record AntiPatternWarning(String patternName, String redFlag, String message) {}
