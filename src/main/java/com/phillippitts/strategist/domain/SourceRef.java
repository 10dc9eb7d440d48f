package com.phillippitts.strategist.domain;

import java.util.Objects;

/**
 * A citation shown next to an agent answer.
 *
 * @param title display title (file name for internal sources)
 * @param url   link, empty for internal sources
 * @param date  publication date, empty when unknown
 */
public record SourceRef(String title, String url, String date) {

    public SourceRef {
        Objects.requireNonNull(title, "title");
        url = url == null ? "" : url;
        date = date == null ? "" : date;
    }

    public static SourceRef internal(String file, String date) {
        return new SourceRef(file, "", date);
    }
}
