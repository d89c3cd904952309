package com.neighborgrid.grid;

/**
 * Maps logical {@code (x, y)} coordinates to canonical row-major offsets and back.
 *
 * <p>Canonical space has its origin in the upper-left cell, x growing rightward and y growing
 * downward. A logical coordinate is first flipped on the y axis when {@code invertedY} is set and
 * then translated from the configured {@link Origin}. {@link #toLogical} undoes both steps exactly.
 */
public final class CoordinateSystem {

    private CoordinateSystem() {
    }

    public static int toOffset(GridGeometry geometry, int x, int y) {
        long logicalY = geometry.options().invertedY() ? -(long) y : y;
        long canonicalX = canonicalX(geometry, x);
        long canonicalY = canonicalY(geometry, logicalY);
        if (canonicalX < 0 || canonicalX >= geometry.columns() || canonicalY < 0 || canonicalY >= geometry.rows()) {
            throw new GridException(GridError.INDEX_OUT_OF_BOUNDS,
                    "(" + x + ", " + y + ") outside " + geometry.columns() + "x" + geometry.rows()
                            + " grid with origin " + geometry.options().origin());
        }
        return (int) (canonicalY * geometry.columns() + canonicalX);
    }

    public static boolean contains(GridGeometry geometry, int x, int y) {
        long logicalY = geometry.options().invertedY() ? -(long) y : y;
        long canonicalX = canonicalX(geometry, x);
        long canonicalY = canonicalY(geometry, logicalY);
        return canonicalX >= 0 && canonicalX < geometry.columns() && canonicalY >= 0 && canonicalY < geometry.rows();
    }

    public static int logicalX(GridGeometry geometry, int offset) {
        geometry.requireOffset(offset);
        return fromCanonicalX(geometry, geometry.columnOf(offset));
    }

    public static int logicalY(GridGeometry geometry, int offset) {
        geometry.requireOffset(offset);
        int y = fromCanonicalY(geometry, geometry.rowOf(offset));
        return geometry.options().invertedY() ? -y : y;
    }

    public static Point toLogical(GridGeometry geometry, int offset) {
        return Point.of(logicalX(geometry, offset), logicalY(geometry, offset));
    }

    public static int minX(GridGeometry geometry) {
        return Math.min(logicalX(geometry, 0), logicalX(geometry, geometry.size() - 1));
    }

    public static int maxX(GridGeometry geometry) {
        return Math.max(logicalX(geometry, 0), logicalX(geometry, geometry.size() - 1));
    }

    public static int minY(GridGeometry geometry) {
        return Math.min(logicalY(geometry, 0), logicalY(geometry, geometry.size() - 1));
    }

    public static int maxY(GridGeometry geometry) {
        return Math.max(logicalY(geometry, 0), logicalY(geometry, geometry.size() - 1));
    }

    private static long canonicalX(GridGeometry geometry, long x) {
        int lastColumn = geometry.columns() - 1;
        return switch (geometry.options().origin()) {
            case UPPER_LEFT, LOWER_LEFT -> x;
            case UPPER_RIGHT, LOWER_RIGHT -> x + lastColumn;
            case CENTER -> x + geometry.columns() / 2;
        };
    }

    private static long canonicalY(GridGeometry geometry, long y) {
        int lastRow = geometry.rows() - 1;
        return switch (geometry.options().origin()) {
            case UPPER_LEFT, UPPER_RIGHT -> -y;
            case LOWER_LEFT, LOWER_RIGHT -> lastRow - y;
            case CENTER -> geometry.rows() / 2 - y;
        };
    }

    private static int fromCanonicalX(GridGeometry geometry, int canonicalX) {
        int lastColumn = geometry.columns() - 1;
        return switch (geometry.options().origin()) {
            case UPPER_LEFT, LOWER_LEFT -> canonicalX;
            case UPPER_RIGHT, LOWER_RIGHT -> canonicalX - lastColumn;
            case CENTER -> canonicalX - geometry.columns() / 2;
        };
    }

    private static int fromCanonicalY(GridGeometry geometry, int canonicalY) {
        int lastRow = geometry.rows() - 1;
        return switch (geometry.options().origin()) {
            case UPPER_LEFT, UPPER_RIGHT -> -canonicalY;
            case LOWER_LEFT, LOWER_RIGHT -> lastRow - canonicalY;
            case CENTER -> geometry.rows() / 2 - canonicalY;
        };
    }
}
