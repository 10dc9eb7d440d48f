package com.phillippitts.strategist.domain;

import java.util.Objects;

/**
 * A retrieved internal document fragment.
 *
 * @param source file name the fragment was loaded from
 * @param date   publication date as written in the source, or empty when unknown
 * @param text   fragment text handed to the generation step
 */
public record Document(String source, String date, String text) {

    public Document {
        Objects.requireNonNull(source, "source");
        date = date == null ? "" : date;
        text = text == null ? "" : text;
    }
}
