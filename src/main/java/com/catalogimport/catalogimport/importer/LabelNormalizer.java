package com.catalogimport.catalogimport.importer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of free-text labels, used as the identity key when labels are compared or de-duplicated.
 */
public final class LabelNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private LabelNormalizer() {
    }

    /**
     * Trims, collapses internal whitespace runs to one space and lower-cases the text.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE_RUN.matcher(text.strip()).replaceAll(" ");
        return collapsed.toLowerCase(Locale.ROOT);
    }
}
