package com.neighborgrid.grid;

/**
 * Named-field form of a logical coordinate. Resolves exactly like {@link Point}.
 */
public record Coordinates(int x, int y) implements GridIndex {

    public static final IndexFactory<Coordinates> FACTORY = (offset, geometry) -> new Coordinates(
            CoordinateSystem.logicalX(geometry, offset),
            CoordinateSystem.logicalY(geometry, offset));

    @Override
    public int resolve(GridGeometry geometry) {
        return CoordinateSystem.toOffset(geometry, x, y);
    }

    public Coordinates translate(int dx, int dy) {
        return new Coordinates(Math.addExact(x, dx), Math.addExact(y, dy));
    }

    public Point toPoint() {
        return Point.of(x, y);
    }
}
