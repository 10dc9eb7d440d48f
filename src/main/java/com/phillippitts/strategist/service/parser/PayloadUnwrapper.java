package com.phillippitts.strategist.service.parser;

import com.phillippitts.strategist.domain.WebsearchDigest;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the loosely encoded websearch payload into a {@link WebsearchDigest}.
 *
 * <p>Accepted shapes, all observed from providers:
 * <ul>
 *   <li>a structured object ({@link JSONObject} or {@link Map}) with {@code summary}/{@code bullets}</li>
 *   <li>a string holding that object, optionally inside a code fence with a language tag</li>
 *   <li>a double-encoded value: a JSON string literal holding the object, or a {@code summary}
 *       field that itself holds (fenced) JSON</li>
 * </ul>
 *
 * <p>At most two decode passes are made per value. When nothing decodes, the original string
 * becomes plain display text. Safe against malformed input: never throws.
 */
@Component
public class PayloadUnwrapper {

    private static final int MAX_DECODE_PASSES = 2;

    public WebsearchDigest unwrap(Object raw) {
        return unwrap(raw, null);
    }

    /**
     * @param raw          provider payload (JSONObject, Map, String or null)
     * @param fallbackText secondary text tried when {@code raw} yields neither summary nor bullets
     */
    public WebsearchDigest unwrap(Object raw, String fallbackText) {
        String summary = "";
        List<String> bullets = List.of();

        JSONObject payload = toObject(raw);
        if (payload != null) {
            summary = textOf(payload.opt("summary"));
            bullets = bulletsOf(payload.opt("bullets"));

            // summary may itself carry the encoded object
            JSONObject nested = payload.opt("summary") instanceof JSONObject o ? o : decodeObject(summary);
            if (nested != null && (nested.has("summary") || nested.has("bullets"))) {
                summary = textOf(nested.opt("summary"));
                List<String> nestedBullets = bulletsOf(nested.opt("bullets"));
                if (!nestedBullets.isEmpty()) {
                    bullets = nestedBullets;
                }
            }
        }

        if (summary.isBlank() && bullets.isEmpty() && fallbackText != null) {
            JSONObject fromFallback = decodeObject(fallbackText);
            if (fromFallback != null) {
                summary = textOf(fromFallback.opt("summary"));
                bullets = bulletsOf(fromFallback.opt("bullets"));
            }
        }

        summary = unquote(stripFences(summary));
        if (!summary.isBlank() || !bullets.isEmpty()) {
            return new WebsearchDigest(summary, bullets, "");
        }
        return new WebsearchDigest("", List.of(), displayFallback(raw, fallbackText));
    }

    /**
     * Removes a leading code fence line (with optional language tag) and a trailing fence.
     */
    public static String stripFences(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip();
        if (s.startsWith("```")) {
            int newline = s.indexOf('\n');
            if (newline >= 0) {
                s = s.substring(newline + 1);
            } else {
                s = s.substring(3).replaceFirst("^[A-Za-z0-9_+-]*", "");
            }
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.strip();
    }

    private static JSONObject toObject(Object raw) {
        if (raw instanceof JSONObject o) {
            return o;
        }
        if (raw instanceof Map<?, ?> map) {
            try {
                return new JSONObject(map);
            } catch (RuntimeException e) {
                return null;
            }
        }
        if (raw instanceof String s) {
            return decodeObject(s);
        }
        return null;
    }

    /**
     * Decodes an object from text, unwrapping fences and one level of string encoding.
     *
     * @return the object, or null if the text holds none
     */
    public static JSONObject decodeObject(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String candidate = stripFences(text);
        for (int pass = 0; pass < MAX_DECODE_PASSES; pass++) {
            Object value = parseValue(candidate);
            if (value instanceof JSONObject o) {
                return o;
            }
            if (value instanceof String inner) {
                candidate = stripFences(inner);
                continue;
            }
            break;
        }
        return decodeEmbeddedObject(candidate);
    }

    private static Object parseValue(String text) {
        String s = text.strip();
        if (!(s.startsWith("{") || s.startsWith("\""))) {
            return null;
        }
        try {
            JSONTokener tokener = new JSONTokener(s);
            return tokener.nextValue();
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * Last resort for prose around an object: decode from the first '{' to the last '}'.
     */
    private static JSONObject decodeEmbeddedObject(String text) {
        int open = text.indexOf('{');
        int close = text.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return null;
        }
        try {
            return new JSONObject(text.substring(open, close + 1));
        } catch (JSONException e) {
            return null;
        }
    }

    private static String textOf(Object value) {
        if (value == null || value == JSONObject.NULL) {
            return "";
        }
        return value instanceof String s ? s.strip() : value.toString().strip();
    }

    private static List<String> bulletsOf(Object value) {
        List<String> bullets = new ArrayList<>();
        if (value instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                String bullet = unquote(textOf(array.opt(i)));
                if (!bullet.isBlank()) {
                    bullets.add(bullet);
                }
            }
        } else if (value instanceof String s && !s.isBlank()) {
            for (String line : s.split("\\R")) {
                String bullet = unquote(line.strip().replaceFirst("^[-*•]\\s*", ""));
                if (!bullet.isBlank()) {
                    bullets.add(bullet);
                }
            }
        }
        return bullets;
    }

    private static String unquote(String s) {
        String t = s == null ? "" : s.strip();
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) {
            return t.substring(1, t.length() - 1).strip();
        }
        return t;
    }

    private static String displayFallback(Object raw, String fallbackText) {
        if (raw instanceof String s && !s.isBlank()) {
            return stripFences(s);
        }
        return fallbackText == null ? "" : stripFences(fallbackText);
    }
}
