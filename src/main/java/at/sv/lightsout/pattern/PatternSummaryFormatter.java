package at.sv.lightsout.pattern;

import at.sv.lightsout.FormatUtil;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders mined patterns as a human readable summary, grouped by type.
 */
public final class PatternSummaryFormatter {

    static final int MAX_PATTERNS_PER_TYPE = 5;

    private PatternSummaryFormatter() {
    }

    public static String format(List<Pattern> patterns) {
        if (patterns.isEmpty()) {
            return "No patterns detected yet. Collect more data.";
        }
        Map<PatternType, List<Pattern>> byType = patterns.stream()
                                                         .collect(Collectors.groupingBy(Pattern::getType,
                                                                 () -> new EnumMap<>(PatternType.class),
                                                                 Collectors.toList()));
        StringBuilder summary = new StringBuilder("Detected patterns:");
        byType.forEach((type, typePatterns) -> {
            summary.append("\n\n").append(getTitle(type)).append(":");
            typePatterns.stream()
                        .sorted(Comparator.comparingDouble(Pattern::getConfidence).reversed())
                        .limit(MAX_PATTERNS_PER_TYPE)
                        .forEach(pattern -> summary.append("\n  - ")
                                                   .append(pattern.getDescription())
                                                   .append(" (confidence: ")
                                                   .append(FormatUtil.formatConfidencePercent(pattern.getConfidence()))
                                                   .append(", seen ")
                                                   .append(pattern.getOccurrenceCount())
                                                   .append(" times)"));
        });
        return summary.toString();
    }

    private static String getTitle(PatternType type) {
        return switch (type) {
            case TIME_BASED -> "Time based";
            case SEQUENCE -> "Sequences";
            case CORRELATION -> "Correlations";
        };
    }
}
