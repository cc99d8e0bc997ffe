package com.mnp.stats.alias;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Folds typographic quotes to the ASCII forms used by the match archive.
 */
@UtilityClass
public class TypographicPunctuation {

    public static String toAscii(String text) {
        if (text == null) return null;
        return text
                .replace('‘', '\'')
                .replace('’', '\'')
                .replace('ʼ', '\'')
                .replace('“', '"')
                .replace('”', '"');
    }

    public static boolean hasTypographicQuotes(String text) {
        return text != null && !text.equals(toAscii(text));
    }

    /**
     * The variation followed by its ASCII twin when the two differ.
     */
    public static List<String> withAsciiTwin(String variation) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(variation);
        forms.add(toAscii(variation));
        return List.copyOf(forms);
    }
}
