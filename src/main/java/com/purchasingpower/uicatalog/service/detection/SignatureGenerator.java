package com.purchasingpower.uicatalog.service.detection;

import com.purchasingpower.uicatalog.model.design.DesignObject;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the fuzzy grouping key of a design object.
 *
 * <p>Key format: {@code type_name_w_h}, where the name is lower-cased with digit runs
 * replaced by {@code N} and separator runs collapsed to {@code _}, and {@code w}/{@code h}
 * are the width and height floored to tens. "btn-1" and "btn_2" at 120x40 and 124x38
 * share a key.
 */
@Component
public class SignatureGenerator {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern SEPARATORS = Pattern.compile("[_-]+");
    private static final String UNKNOWN_TYPE = "unknown";

    public String signature(DesignObject object) {
        String type = object.getType().isEmpty() ? UNKNOWN_TYPE : object.getType();
        return String.join("_",
                type,
                normalizeName(object.getName()),
                String.valueOf(sizeBucket(object.getWidth())),
                String.valueOf(sizeBucket(object.getHeight())));
    }

    String normalizeName(String name) {
        String normalized = name.toLowerCase(Locale.ROOT);
        normalized = DIGITS.matcher(normalized).replaceAll("N");
        return SEPARATORS.matcher(normalized).replaceAll("_");
    }

    private static long sizeBucket(double size) {
        return (long) Math.floor(size / 10);
    }
}
