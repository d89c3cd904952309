package com.neighborgrid.grid;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class PartitionerTest {

    private static Grid<Integer> sequenceGrid(int columns, int rows, int first) {
        List<Integer> items = IntStream.range(first, first + columns * rows).boxed().toList();
        return Grids.fromFlat(items, columns, rows, GridOptions.defaults());
    }

    private static <T> List<T> collect(Iterable<T> values) {
        List<T> list = new ArrayList<>();
        values.forEach(list::add);
        return list;
    }

    @Test
    void quadrantsOfTwoByTwo() {
        Grid<Integer> grid = sequenceGrid(2, 2, 0);
        for (int offset = 0; offset < 4; offset++) {
            assertEquals(offset, grid.quadrant(Offset.of(offset)));
        }
    }

    @Test
    void raggedQuadrantsUseCeilingExtents() {
        Grid<Integer> grid = sequenceGrid(3, 2, 0);
        assertEquals(0, grid.quadrant(Point.of(0, 0)));
        assertEquals(0, grid.quadrant(Point.of(1, 0)));
        assertEquals(1, grid.quadrant(Point.of(2, 0)));
        assertEquals(2, grid.quadrant(Point.of(0, 1)));
        assertEquals(2, grid.quadrant(Point.of(1, 1)));
        assertEquals(3, grid.quadrant(Point.of(2, 1)));

        GridGeometry geometry = grid.geometry();
        assertEquals(2, Partitioner.regionStart(geometry, 1, 2));
        assertEquals(3, Partitioner.regionStart(geometry, 2, 2));
        assertEquals(5, Partitioner.regionStart(geometry, 3, 2));
        assertEquals(2, Partitioner.regionWidth(geometry, 2));
        assertEquals(1, Partitioner.regionHeight(geometry, 2));
    }

    @Test
    void raggedRegionHasAbsentSlots() {
        Grid<Integer> grid = sequenceGrid(3, 2, 0);
        assertEquals(List.of(Optional.of(2), Optional.empty()), collect(grid.quadrantRegion(Offset.of(2))));
        assertEquals(List.of(Optional.of(0), Optional.of(1)), collect(grid.quadrantRegion(Offset.of(1))));
    }

    @Test
    void sudokuBoxes() {
        Grid<Integer> grid = sequenceGrid(9, 9, 1);
        assertEquals(
                List.of(1, 2, 3, 10, 11, 12, 19, 20, 21),
                collect(grid.region(3, Offset.of(10))).stream().map(Optional::orElseThrow).toList());
        assertEquals(
                List.of(61, 62, 63, 70, 71, 72, 79, 80, 81),
                collect(grid.region(3, Offset.of(80))).stream().map(Optional::orElseThrow).toList());
        assertEquals(8, grid.nrant(Offset.of(80), 3));
        assertTrue(collect(grid.quadrantRegion(Point.of(10, 10))).isEmpty());
    }

    @Test
    void regionsCoverEveryCellExactlyOnce() {
        for (int divisor = 1; divisor <= 7; divisor++) {
            Grid<Integer> grid = sequenceGrid(7, 5, 0);
            int[] hits = new int[grid.size()];
            for (int region = 0; region < Partitioner.regionCount(grid.geometry(), divisor); region++) {
                for (Optional<Integer> slot : grid.regionById(divisor, region)) {
                    slot.ifPresent(value -> hits[value]++);
                }
            }
            int[] expected = new int[grid.size()];
            Arrays.fill(expected, 1);
            assertArrayEquals(expected, hits, "divisor " + divisor);
        }
    }

    @Test
    void regionArityIsConstant() {
        Grid<Integer> grid = sequenceGrid(7, 5, 0);
        int divisor = 3;
        int arity = Partitioner.regionWidth(grid.geometry(), divisor) * Partitioner.regionHeight(grid.geometry(), divisor);
        for (int region = 0; region < 9; region++) {
            assertEquals(arity, collect(grid.regionById(divisor, region)).size());
        }
    }

    @Test
    void nrantMatchesRegionMembership() {
        Grid<Integer> grid = sequenceGrid(7, 5, 0);
        for (int offset = 0; offset < grid.size(); offset++) {
            long region = grid.nrant(Offset.of(offset), 3);
            assertTrue(collect(grid.regionById(3, region)).contains(Optional.of(offset)));
        }
    }

    @Test
    void invalidDivisorsAreRejected() {
        Grid<Integer> grid = sequenceGrid(3, 2, 0);
        GridException zero = assertThrows(GridException.class, () -> grid.nrant(Offset.of(0), 0));
        assertEquals(GridError.INVALID_DIVISION_SIZE, zero.error());
        GridException large = assertThrows(GridException.class, () -> grid.region(4, Offset.of(0)));
        assertEquals(GridError.INVALID_DIVISION_SIZE, large.error());
        GridException negative = assertThrows(GridException.class, () -> grid.regionById(-1, 0));
        assertEquals(GridError.INVALID_DIVISION_SIZE, negative.error());
    }

    @Test
    void divisorAsLargeAsWideRowKeepsRegionsReachable() {
        Grid<Integer> grid = Grids.filled(65536, 1, 7, GridOptions.defaults());
        GridGeometry geometry = grid.geometry();
        assertEquals(65536L * 65536L, Partitioner.regionCount(geometry, 65536));
        assertEquals(0, grid.nrant(Offset.of(0), 65536));
        assertEquals(65535, grid.nrant(Offset.of(65535), 65536));
        assertEquals(List.of(Optional.of(7)), collect(grid.region(65536, Offset.of(0))));
        assertEquals(List.of(Optional.of(7)), collect(grid.regionById(65536, 65535)));
        assertEquals(List.of(Optional.empty()), collect(grid.regionById(65536, 65536)));
    }

    @Test
    void tallColumnRegionIdsExceedIntRange() {
        Grid<Integer> grid = Grids.filled(1, 65536, 3, GridOptions.defaults());
        long last = grid.nrant(Offset.of(65535), 65536);
        assertEquals(65535L * 65536L, last);
        assertEquals(List.of(Optional.of(3)), collect(grid.regionById(65536, last)));
        assertEquals(65535L, Partitioner.regionStart(grid.geometry(), last, 65536));
        GridException error = assertThrows(GridException.class,
                () -> grid.regionById(65536, 65536L * 65536L));
        assertEquals(GridError.INDEX_OUT_OF_BOUNDS, error.error());
    }

    @Test
    void divisorOfOneCoversWholeGrid() {
        Grid<Integer> grid = sequenceGrid(3, 2, 0);
        assertEquals(0, grid.nrant(Offset.of(5), 1));
        assertEquals(6, collect(grid.region(1, Offset.of(3))).size());
    }
}
