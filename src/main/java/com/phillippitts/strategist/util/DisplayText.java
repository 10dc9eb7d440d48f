package com.phillippitts.strategist.util;

import java.util.regex.Pattern;

/**
 * Cleans agent answers for display: models occasionally emit HTML line breaks and tags.
 */
public final class DisplayText {

    private static final Pattern BR = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    private DisplayText() {}

    /**
     * Replaces {@code <br>} with a space and removes all other tags; returns "" for null.
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String s = BR.matcher(text).replaceAll(" ");
        return TAG.matcher(s).replaceAll("").strip();
    }
}
