package com.neighborgrid.grid;

/**
 * Signed {@code (x, y)} pair in the grid's logical coordinate system.
 */
public record Point(int x, int y) implements GridIndex {

    public static final IndexFactory<Point> FACTORY = (offset, geometry) -> CoordinateSystem.toLogical(geometry, offset);

    public static Point of(int x, int y) {
        return new Point(x, y);
    }

    @Override
    public int resolve(GridGeometry geometry) {
        return CoordinateSystem.toOffset(geometry, x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
