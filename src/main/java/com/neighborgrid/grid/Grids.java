package com.neighborgrid.grid;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Conversions from plain Java collections into {@link Grid}s.
 */
public final class Grids {

    /**
     * Total cell counts at or above this value are refused. Larger arrays cannot be allocated
     * reliably on the JVM.
     */
    public static final long MAX_CELLS = Integer.MAX_VALUE - 8L;

    private Grids() {
    }

    public static <T> Grid<T> fromRows(List<? extends List<? extends T>> rows, GridOptions options) {
        Objects.requireNonNull(rows, "rows");
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            throw new GridException(GridError.INVALID_SIZE, "grid needs at least one row and one column");
        }
        int rowCount = rows.size();
        int columns = rows.get(0).size();
        GridGeometry geometry = geometry(rowCount, columns, options);
        Object[] items = new Object[geometry.size()];
        int offset = 0;
        for (int row = 0; row < rowCount; row++) {
            List<? extends T> values = rows.get(row);
            if (values.size() != columns) {
                throw new GridException(GridError.ROW_SIZE_MISMATCH,
                        "row " + row + " has " + values.size() + " cells, expected " + columns);
            }
            for (T value : values) {
                items[offset++] = value;
            }
        }
        return new Grid<>(geometry, items);
    }

    public static <T> Grid<T> fromFlat(List<? extends T> items, int columns, int rows, GridOptions options) {
        Objects.requireNonNull(items, "items");
        GridGeometry geometry = geometry(rows, columns, options);
        if (items.size() != geometry.size()) {
            throw new GridException(GridError.INVALID_SIZE,
                    items.size() + " items do not fill " + columns + " columns x " + rows + " rows");
        }
        return new Grid<>(geometry, items.toArray());
    }

    /**
     * Builds a grid whose every row is a copy of {@code pattern}.
     */
    public static <T> Grid<T> repeatRow(List<? extends T> pattern, int rowCount, GridOptions options) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isEmpty() || rowCount <= 0) {
            throw new GridException(GridError.INVALID_SIZE,
                    "pattern of " + pattern.size() + " cells repeated " + rowCount + " times");
        }
        GridGeometry geometry = geometry(rowCount, pattern.size(), options);
        Object[] row = pattern.toArray();
        Object[] items = new Object[geometry.size()];
        for (int r = 0; r < rowCount; r++) {
            System.arraycopy(row, 0, items, r * row.length, row.length);
        }
        return new Grid<>(geometry, items);
    }

    public static <T> Grid<T> filled(int columns, int rows, T value, GridOptions options) {
        Objects.requireNonNull(value, "value");
        GridGeometry geometry = geometry(rows, columns, options);
        Object[] items = new Object[geometry.size()];
        Arrays.fill(items, value);
        return new Grid<>(geometry, items);
    }

    private static GridGeometry geometry(int rows, int columns, GridOptions options) {
        return new GridGeometry(rows, columns, options == null ? GridOptions.defaults() : options);
    }
}
