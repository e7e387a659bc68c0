package com.purchasingpower.uicatalog.util;

import java.util.Collection;
import java.util.function.ToDoubleFunction;

/**
 * Zero-safe ratio and average helpers. Every result over an empty input is 0.
 */
public final class Ratios {

    private Ratios() {
    }

    public static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    public static <T> double average(Collection<T> items, ToDoubleFunction<T> metric) {
        if (items.isEmpty()) {
            return 0.0;
        }
        return items.stream().mapToDouble(metric).sum() / items.size();
    }

    public static double mean(double... values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
