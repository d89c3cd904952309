package com.neighborgrid.grid;

import java.util.List;
import java.util.Objects;

/**
 * Coordinate and neighbor configuration copied into a {@link Grid} at construction.
 *
 * <p>For most grids, with x and y values always positive, {@link Origin#UPPER_LEFT} with
 * {@code invertedY} set is the best fit and is the default: {@code (1, 2)} then addresses column 1
 * of row 2.
 */
public final class GridOptions {

    public static final boolean DEFAULT_INVERTED_Y = true;
    public static final boolean DEFAULT_NEIGHBOR_Y_BASED = true;
    public static final boolean DEFAULT_WRAP = false;

    private static final GridOptions DEFAULTS = builder().build();
    private static final String SEPARATOR = "_";

    private final Origin origin;
    private final boolean invertedY;
    private final boolean neighborYBased;
    private final boolean wrapX;
    private final boolean wrapY;

    private GridOptions(Builder builder) {
        this.origin = builder.origin;
        this.invertedY = builder.invertedY;
        this.neighborYBased = builder.neighborYBased;
        this.wrapX = builder.wrapX;
        this.wrapY = builder.wrapY;
    }

    public static GridOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .origin(origin)
                .invertedY(invertedY)
                .neighborYBased(neighborYBased)
                .wrapX(wrapX)
                .wrapY(wrapY);
    }

    public Origin origin() {
        return origin;
    }

    public boolean invertedY() {
        return invertedY;
    }

    public boolean neighborYBased() {
        return neighborYBased;
    }

    public boolean wrapX() {
        return wrapX;
    }

    public boolean wrapY() {
        return wrapY;
    }

    /**
     * Whether the public "up" direction follows the logical y axis rather than storage row order.
     */
    public boolean upFollowsLogicalY() {
        return invertedY && neighborYBased;
    }

    public String serialize() {
        return String.join(SEPARATOR, List.of(
                origin.code(),
                flag(invertedY),
                flag(neighborYBased),
                flag(wrapX),
                flag(wrapY)));
    }

    public static GridOptions deserialize(String serialized) {
        Objects.requireNonNull(serialized, "serialized");
        String[] parts = serialized.trim().split(SEPARATOR, -1);
        if (parts.length != 5) {
            throw new IllegalArgumentException("Serialized grid options must contain 5 parts but found " + parts.length);
        }
        return builder()
                .origin(Origin.fromCode(parts[0]))
                .invertedY(parseFlag(parts[1], "invertedY"))
                .neighborYBased(parseFlag(parts[2], "neighborYBased"))
                .wrapX(parseFlag(parts[3], "wrapX"))
                .wrapY(parseFlag(parts[4], "wrapY"))
                .build();
    }

    private static String flag(boolean value) {
        return value ? "1" : "0";
    }

    private static boolean parseFlag(String value, String label) {
        if ("1".equals(value) || "true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("0".equals(value) || "false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid " + label + " value '" + value + "'");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GridOptions other)) {
            return false;
        }
        return origin == other.origin
                && invertedY == other.invertedY
                && neighborYBased == other.neighborYBased
                && wrapX == other.wrapX
                && wrapY == other.wrapY;
    }

    @Override
    public int hashCode() {
        return Objects.hash(origin, invertedY, neighborYBased, wrapX, wrapY);
    }

    @Override
    public String toString() {
        return "GridOptions[" + serialize() + "]";
    }

    public static final class Builder {
        private Origin origin = Origin.UPPER_LEFT;
        private boolean invertedY = DEFAULT_INVERTED_Y;
        private boolean neighborYBased = DEFAULT_NEIGHBOR_Y_BASED;
        private boolean wrapX = DEFAULT_WRAP;
        private boolean wrapY = DEFAULT_WRAP;

        private Builder() {
        }

        public Builder origin(Origin origin) {
            this.origin = Objects.requireNonNull(origin, "origin");
            return this;
        }

        public Builder invertedY(boolean invertedY) {
            this.invertedY = invertedY;
            return this;
        }

        public Builder neighborYBased(boolean neighborYBased) {
            this.neighborYBased = neighborYBased;
            return this;
        }

        public Builder wrapX(boolean wrapX) {
            this.wrapX = wrapX;
            return this;
        }

        public Builder wrapY(boolean wrapY) {
            this.wrapY = wrapY;
            return this;
        }

        public Builder wrap(boolean wrap) {
            this.wrapX = wrap;
            this.wrapY = wrap;
            return this;
        }

        public GridOptions build() {
            return new GridOptions(this);
        }
    }
}
