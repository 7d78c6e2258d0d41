package com.ventture.credit.service.features;

import com.ventture.credit.engine.error.InvalidValueException;

import java.util.Locale;

/** How quickly a guarantee can be turned into cash. */
public enum Liquidity {
    LOW(1, "baixa"),
    MEDIUM(2, "media"),
    HIGH(3, "alta");

    private final int score;
    private final String ptName;

    Liquidity(int score, String ptName) {
        this.score = score;
        this.ptName = ptName;
    }

    public int score() {
        return score;
    }

    public static Liquidity parse(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toLowerCase(Locale.ROOT).replace("é", "e");
        for (Liquidity l : values()) {
            if (l.name().toLowerCase(Locale.ROOT).equals(v) || l.ptName.equals(v)) return l;
        }
        throw new InvalidValueException("liquidity", "Unknown guarantee liquidity '" + raw + "' (expected low, medium or high)");
    }
}
