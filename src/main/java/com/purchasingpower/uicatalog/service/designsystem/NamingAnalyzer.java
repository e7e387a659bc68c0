package com.purchasingpower.uicatalog.service.designsystem;

import com.purchasingpower.uicatalog.model.catalog.ComponentPatterns.NamingPatterns;
import com.purchasingpower.uicatalog.model.catalog.NamedCount;
import com.purchasingpower.uicatalog.util.TextCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Naming statistics over component display names.
 */
@Component
public class NamingAnalyzer {

    private static final Pattern WORD_SEPARATORS = Pattern.compile("[_\\-\\s]+");

    public NamingPatterns analyze(List<String> names) {
        return NamingPatterns.builder()
                .namingConsistency(namingConsistency(names))
                .commonPrefixes(commonWords(names, words -> words[0]))
                .commonSuffixes(commonWords(names, words -> words[words.length - 1]))
                .namingConventions(namingConventions(names))
                .build();
    }

    /**
     * Share of names using the most frequent case pattern. No names score 0, a single name 1.
     * Ties between patterns go to the pattern seen first.
     */
    public double namingConsistency(List<String> names) {
        if (names.isEmpty()) {
            return 0.0;
        }
        if (names.size() == 1) {
            return 1.0;
        }

        Map<CasePattern, Long> patternCounts = new LinkedHashMap<>();
        for (String name : names) {
            patternCounts.merge(CasePattern.of(name), 1L, Long::sum);
        }
        long dominant = patternCounts.values().stream().mapToLong(Long::longValue).max().orElse(0L);
        return (double) dominant / names.size();
    }

    /**
     * Distinct leading words, splitting on whitespace.
     */
    public long distinctFirstWords(List<String> names) {
        return names.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .map(name -> name.split("\\s+")[0])
                .distinct()
                .count();
    }

    private List<NamedCount> commonWords(List<String> names, Function<String[], String> pick) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String name : names) {
            String[] words = WORD_SEPARATORS.split(name.toLowerCase(Locale.ROOT), -1);
            counts.merge(pick.apply(words), 1L, Long::sum);
        }
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(entry -> new NamedCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private List<String> namingConventions(List<String> names) {
        List<String> conventions = new ArrayList<>();
        if (names.stream().anyMatch(name -> name.contains("_"))) {
            conventions.add("snake_case");
        }
        if (names.stream().anyMatch(name -> name.contains("-"))) {
            conventions.add("kebab-case");
        }
        if (names.stream().anyMatch(TextCase::hasInnerUpper)) {
            conventions.add("camelCase");
        }
        return conventions;
    }
}
