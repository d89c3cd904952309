package com.neighborgrid.grid;

public record Offset(int value) implements GridIndex {

    public static final IndexFactory<Offset> FACTORY = (offset, geometry) -> new Offset(offset);

    public static Offset of(int value) {
        return new Offset(value);
    }

    @Override
    public int resolve(GridGeometry geometry) {
        return geometry.requireOffset(value);
    }
}
