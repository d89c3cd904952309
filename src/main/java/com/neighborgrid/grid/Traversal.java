package com.neighborgrid.grid;

/**
 * A finite sequence of slots, each either a storage offset or {@link #ABSENT}. Grids wrap these in
 * restartable iterables.
 */
abstract class Traversal {

    static final int ABSENT = -1;

    private static final Traversal EMPTY = strided(0, 0, 1);

    abstract int length();

    abstract int offsetAt(int slot);

    static Traversal empty() {
        return EMPTY;
    }

    static Traversal row(GridGeometry geometry, int offset) {
        return strided(geometry.rowStart(offset), geometry.columns(), 1);
    }

    static Traversal column(GridGeometry geometry, int offset) {
        return strided(geometry.columnOf(offset), geometry.rows(), geometry.columns());
    }

    static Traversal all(GridGeometry geometry) {
        return strided(0, geometry.size(), 1);
    }

    /**
     * Window of {@code regionWidth x regionHeight} slots starting at the region's first cell. Slots
     * past the right or bottom edge of the grid are absent, so every region has the same arity.
     */
    static Traversal region(GridGeometry geometry, int divisor, long regionId) {
        int width = Partitioner.regionWidth(geometry, divisor);
        int height = Partitioner.regionHeight(geometry, divisor);
        long startRow = Partitioner.regionStartRow(geometry, regionId, divisor);
        long startColumn = Partitioner.regionStartColumn(geometry, regionId, divisor);
        return new Traversal() {
            @Override
            int length() {
                return width * height;
            }

            @Override
            int offsetAt(int slot) {
                long row = startRow + slot / width;
                long column = startColumn + slot % width;
                if (row >= geometry.rows() || column >= geometry.columns()) {
                    return ABSENT;
                }
                return (int) (row * geometry.columns() + column);
            }
        };
    }

    private static Traversal strided(int start, int count, int stride) {
        return new Traversal() {
            @Override
            int length() {
                return count;
            }

            @Override
            int offsetAt(int slot) {
                return start + slot * stride;
            }
        };
    }
}
