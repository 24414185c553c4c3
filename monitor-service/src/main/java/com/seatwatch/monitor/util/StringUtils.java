package com.seatwatch.monitor.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Domain-specific string utilities.
 * For general string operations, prefer org.springframework.util.StringUtils
 */
public final class StringUtils {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private StringUtils() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Lower-cases a location name and strips diacritics ("Frýdek-Místek" becomes "frydek-mistek").
     */
    public static String normalizeLocationName(String name) {
        if (name == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(name.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
