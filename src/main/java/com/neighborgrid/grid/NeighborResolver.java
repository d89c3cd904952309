package com.neighborgrid.grid;

import java.util.OptionalInt;

/**
 * Offset arithmetic for the cells around a resolved offset.
 *
 * <p>"Raw" steps move in storage row order. The public {@code UP}/{@code DOWN} steps swap the raw
 * directions when {@link GridOptions#upFollowsLogicalY()} holds, so that up always means a larger
 * logical y in that configuration. Diagonals are a vertical step followed by a horizontal one and
 * are absent when either step is.
 */
public final class NeighborResolver {

    private NeighborResolver() {
    }

    public static OptionalInt neighbor(GridGeometry geometry, int offset, Direction direction) {
        geometry.requireOffset(offset);
        OptionalInt vertical = step(geometry, offset, direction.vertical());
        if (vertical.isEmpty()) {
            return vertical;
        }
        return step(geometry, vertical.getAsInt(), direction.horizontal());
    }

    static OptionalInt step(GridGeometry geometry, int offset, Direction.Step step) {
        boolean swapVertical = geometry.options().upFollowsLogicalY();
        return switch (step) {
            case NONE -> OptionalInt.of(offset);
            case UP -> swapVertical ? rawDown(geometry, offset) : rawUp(geometry, offset);
            case DOWN -> swapVertical ? rawUp(geometry, offset) : rawDown(geometry, offset);
            case LEFT -> rawLeft(geometry, offset);
            case RIGHT -> rawRight(geometry, offset);
        };
    }

    static OptionalInt rawUp(GridGeometry geometry, int offset) {
        int columns = geometry.columns();
        if (offset >= columns) {
            return OptionalInt.of(offset - columns);
        }
        if (geometry.options().wrapY()) {
            return OptionalInt.of(offset + geometry.size() - columns);
        }
        return OptionalInt.empty();
    }

    static OptionalInt rawDown(GridGeometry geometry, int offset) {
        int below = offset + geometry.columns();
        if (below < geometry.size()) {
            return OptionalInt.of(below);
        }
        if (geometry.options().wrapY()) {
            return OptionalInt.of(below - geometry.size());
        }
        return OptionalInt.empty();
    }

    static OptionalInt rawLeft(GridGeometry geometry, int offset) {
        if (offset % geometry.columns() != 0) {
            return OptionalInt.of(offset - 1);
        }
        if (geometry.options().wrapX()) {
            return OptionalInt.of(offset + geometry.columns() - 1);
        }
        return OptionalInt.empty();
    }

    static OptionalInt rawRight(GridGeometry geometry, int offset) {
        int next = offset + 1;
        if (next % geometry.columns() != 0) {
            return OptionalInt.of(next);
        }
        if (geometry.options().wrapX()) {
            return OptionalInt.of(next - geometry.columns());
        }
        return OptionalInt.empty();
    }
}
