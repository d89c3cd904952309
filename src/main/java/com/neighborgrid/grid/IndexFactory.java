package com.neighborgrid.grid;

@FunctionalInterface
public interface IndexFactory<I extends GridIndex> {

    /**
     * Rebuilds the coordinate form for an offset that the caller has already validated.
     */
    I materialize(int offset, GridGeometry geometry);
}
