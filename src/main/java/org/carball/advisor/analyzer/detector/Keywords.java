package org.carball.advisor.analyzer.detector;

import java.util.List;
import java.util.Locale;

final class Keywords {

    private Keywords() {
    }

    static boolean containsAny(String name, List<String> keywords) {
        String lower = name.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
