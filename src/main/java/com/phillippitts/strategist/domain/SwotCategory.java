package com.phillippitts.strategist.domain;

/**
 * SWOT categories, identified in the text by their single-letter label.
 */
public enum SwotCategory {
    STRENGTHS('S'),
    WEAKNESSES('W'),
    OPPORTUNITIES('O'),
    THREATS('T');

    private final char letter;

    SwotCategory(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public static SwotCategory fromLetter(char letter) {
        for (SwotCategory c : values()) {
            if (c.letter == Character.toUpperCase(letter)) {
                return c;
            }
        }
        return null;
    }
}
