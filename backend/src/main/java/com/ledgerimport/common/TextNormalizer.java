package com.ledgerimport.common;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Loose normalisation for merchant names and descriptions before table lookups:
 * lower-case, accents stripped, punctuation and store numbers collapsed to single spaces.
 */
public final class TextNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern STORE_NUMBER = Pattern.compile("#\\s*\\d+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private TextNormalizer() {
    }

    public static String looseNormalize(String value) {
        if (value == null) {
            return "";
        }
        String s = Normalizer.normalize(value, Normalizer.Form.NFD);
        s = DIACRITICS.matcher(s).replaceAll("");
        s = s.toLowerCase(Locale.ROOT);
        s = STORE_NUMBER.matcher(s).replaceAll(" ");
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        return s.strip();
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
