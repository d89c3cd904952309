package com.neighborgrid.grid;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class GridsTest {

    @Test
    void fromRowsKeepsRowMajorOrder() {
        Grid<String> grid = Grids.fromRows(List.of(List.of("a", "b"), List.of("c", "d"), List.of("e", "f")), null);
        assertEquals(3, grid.rows());
        assertEquals(2, grid.columns());
        assertEquals(GridOptions.defaults(), grid.options());
        assertEquals(Optional.of("c"), grid.get(0, 1));
    }

    @Test
    void emptyInputIsInvalidSize() {
        GridException noRows = assertThrows(GridException.class, () -> Grids.fromRows(List.of(), null));
        assertEquals(GridError.INVALID_SIZE, noRows.error());
        GridException noColumns = assertThrows(GridException.class,
                () -> Grids.fromRows(List.of(List.of()), null));
        assertEquals(GridError.INVALID_SIZE, noColumns.error());
    }

    @Test
    void raggedRowsAreRejected() {
        GridException error = assertThrows(GridException.class,
                () -> Grids.fromRows(List.of(List.of(1, 2), List.of(3)), null));
        assertEquals(GridError.ROW_SIZE_MISMATCH, error.error());
    }

    @Test
    void flatItemsMustFillGrid() {
        GridException error = assertThrows(GridException.class,
                () -> Grids.fromFlat(List.of(1, 2, 3), 2, 2, null));
        assertEquals(GridError.INVALID_SIZE, error.error());
        assertEquals(4, Grids.fromFlat(List.of(1, 2, 3, 4), 2, 2, null).size());
    }

    @Test
    void centerOriginNeedsOddDimensions() {
        GridOptions center = GridOptions.builder().origin(Origin.CENTER).build();
        GridException error = assertThrows(GridException.class, () -> Grids.filled(4, 3, 0, center));
        assertEquals(GridError.INVALID_SIZE, error.error());
        assertEquals(15, Grids.filled(3, 5, 0, center).size());
    }

    @Test
    void oversizedGridIsRejectedBeforeAllocation() {
        GridException error = assertThrows(GridException.class,
                () -> Grids.filled(100_000, 100_000, 0, null));
        assertEquals(GridError.EXCESSIVE_SIZE, error.error());
        assertTrue(error.getMessage().startsWith(GridError.EXCESSIVE_SIZE.message()));
    }

    @Test
    void nonPositiveDimensionsAreInvalid() {
        assertEquals(GridError.INVALID_SIZE,
                assertThrows(GridException.class, () -> Grids.filled(0, 3, 0, null)).error());
        assertEquals(GridError.INVALID_SIZE,
                assertThrows(GridException.class, () -> Grids.repeatRow(List.of(1), 0, null)).error());
    }

    @Test
    void repeatRowCopiesPattern() {
        Grid<Integer> grid = Grids.repeatRow(List.of(1, 2, 3), 2, null);
        assertEquals(List.of(1, 2, 3), grid.stream().limit(3).toList());
        assertEquals(List.of(1, 2, 3), grid.stream().skip(3).toList());
    }

    @Test
    void nullCellsAreRejected() {
        assertThrows(NullPointerException.class, () -> Grids.fromFlat(Arrays.asList(1, null), 2, 1, null));
    }
}
