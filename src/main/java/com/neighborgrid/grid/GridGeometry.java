package com.neighborgrid.grid;

import java.util.Objects;

/**
 * Shape and options of a grid, without its cells. Everything that maps coordinates to offsets
 * works on this type.
 */
public record GridGeometry(int rows, int columns, GridOptions options) {

    public GridGeometry {
        Objects.requireNonNull(options, "options");
        if (rows <= 0 || columns <= 0) {
            throw new GridException(GridError.INVALID_SIZE, rows + " rows x " + columns + " columns");
        }
        if ((long) rows * columns >= Grids.MAX_CELLS) {
            throw new GridException(GridError.EXCESSIVE_SIZE, rows + " rows x " + columns + " columns");
        }
        if (options.origin().requiresOddDimensions() && (rows % 2 == 0 || columns % 2 == 0)) {
            throw new GridException(GridError.INVALID_SIZE,
                    "origin " + options.origin() + " needs odd dimensions but got " + rows + "x" + columns);
        }
    }

    public int size() {
        return rows * columns;
    }

    public boolean contains(int offset) {
        return offset >= 0 && offset < size();
    }

    public int requireOffset(int offset) {
        if (!contains(offset)) {
            throw new GridException(GridError.INDEX_OUT_OF_BOUNDS, "offset " + offset + " not in [0, " + size() + ")");
        }
        return offset;
    }

    public int rowOf(int offset) {
        return offset / columns;
    }

    public int columnOf(int offset) {
        return offset % columns;
    }

    public int rowStart(int offset) {
        return rowOf(offset) * columns;
    }

    public <I extends GridIndex> I materialize(int offset, IndexFactory<I> factory) {
        Objects.requireNonNull(factory, "factory");
        return factory.materialize(requireOffset(offset), this);
    }
}
