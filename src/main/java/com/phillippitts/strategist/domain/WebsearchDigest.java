package com.phillippitts.strategist.domain;

import java.util.List;

/**
 * Readable form of a websearch payload.
 *
 * @param summary     decoded summary, empty when the payload could not be decoded
 * @param bullets     decoded key facts
 * @param displayText plain text fallback used when nothing decoded
 */
public record WebsearchDigest(String summary, List<String> bullets, String displayText) {

    public WebsearchDigest {
        summary = summary == null ? "" : summary;
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
        displayText = displayText == null ? "" : displayText;
    }

    public boolean isDecoded() {
        return !summary.isBlank() || !bullets.isEmpty();
    }

    public boolean isEmpty() {
        return !isDecoded() && displayText.isBlank();
    }
}
