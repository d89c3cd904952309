package com.neighborgrid.life;

import java.util.BitSet;

/**
 * Birth/survival rule in {@code B#/S#} notation, e.g. {@code B3/S23} for Conway's life.
 */
public final class LifeRule {

    public static final int MAX_NEIGHBORS = 8;

    private final BitSet born;
    private final BitSet survive;
    private final String label;

    private LifeRule(BitSet born, BitSet survive) {
        this.born = born;
        this.survive = survive;
        this.label = "B" + digits(born) + "/S" + digits(survive);
    }

    public static LifeRule parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Rule string is empty");
        }
        String[] parts = raw.trim().split("/", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Rule must follow B#/S# format");
        }
        return new LifeRule(parseCounts(parts[0], 'B'), parseCounts(parts[1], 'S'));
    }

    public static LifeRule defaultLife() {
        return parse("B3/S23");
    }

    public boolean shouldLive(boolean currentlyAlive, int neighborCount) {
        if (neighborCount < 0 || neighborCount > MAX_NEIGHBORS) {
            throw new IllegalArgumentException("Neighbor count must be between 0 and " + MAX_NEIGHBORS);
        }
        return currentlyAlive ? survive.get(neighborCount) : born.get(neighborCount);
    }

    /**
     * Normalized notation with digits in ascending order.
     */
    public String label() {
        return label;
    }

    private static BitSet parseCounts(String segment, char prefix) {
        String trimmed = segment.trim();
        if (trimmed.isEmpty() || Character.toUpperCase(trimmed.charAt(0)) != prefix) {
            throw new IllegalArgumentException("Rule must follow B#/S# format");
        }
        BitSet counts = new BitSet(MAX_NEIGHBORS + 1);
        for (char ch : trimmed.substring(1).toCharArray()) {
            if (!Character.isDigit(ch)) {
                throw new IllegalArgumentException("Invalid digit '" + ch + "' in rule");
            }
            int value = ch - '0';
            if (value > MAX_NEIGHBORS) {
                throw new IllegalArgumentException("Neighbor count " + value + " is out of range 0-" + MAX_NEIGHBORS);
            }
            if (counts.get(value)) {
                throw new IllegalArgumentException("Digit " + value + " is duplicated in rule");
            }
            counts.set(value);
        }
        return counts;
    }

    private static String digits(BitSet counts) {
        StringBuilder builder = new StringBuilder();
        counts.stream().forEach(builder::append);
        return builder.toString();
    }

    @Override
    public String toString() {
        return label;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LifeRule other)) {
            return false;
        }
        return born.equals(other.born) && survive.equals(other.survive);
    }

    @Override
    public int hashCode() {
        return 31 * born.hashCode() + survive.hashCode();
    }
}
