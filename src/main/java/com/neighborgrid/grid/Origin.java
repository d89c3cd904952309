package com.neighborgrid.grid;

/**
 * Which cell of the grid a caller's coordinate system treats as {@code (0, 0)}.
 */
public enum Origin {
    UPPER_LEFT("UL"),
    UPPER_RIGHT("UR"),
    CENTER("C"),
    LOWER_LEFT("LL"),
    LOWER_RIGHT("LR");

    private final String code;

    Origin(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean requiresOddDimensions() {
        return this == CENTER;
    }

    public static Origin fromCode(String code) {
        for (Origin origin : values()) {
            if (origin.code.equalsIgnoreCase(code)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown origin code '" + code + "'");
    }
}
