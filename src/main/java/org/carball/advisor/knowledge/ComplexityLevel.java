package org.carball.advisor.knowledge;

public enum ComplexityLevel {
    SIMPLE("simple"),
    MODERATE("moderate"),
    COMPLEX("complex"),
    ENTERPRISE("enterprise");

    private final String value;

    ComplexityLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isBelow(ComplexityLevel other) {
        return compareTo(other) < 0;
    }
}
