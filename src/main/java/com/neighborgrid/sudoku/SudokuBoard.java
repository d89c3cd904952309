package com.neighborgrid.sudoku;

import com.neighborgrid.grid.Coordinates;
import com.neighborgrid.grid.Grid;
import com.neighborgrid.grid.GridException;
import com.neighborgrid.grid.GridOptions;
import com.neighborgrid.grid.Grids;
import com.neighborgrid.grid.Origin;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sudoku board of side {@code n * n} where {@code 0} marks an empty cell. Cells are addressed as
 * {@code Coordinates(column, row)} with rows counted downward from the top.
 */
public final class SudokuBoard {

    public static final int EMPTY = 0;

    static final GridOptions OPTIONS = GridOptions.builder()
            .origin(Origin.UPPER_LEFT)
            .invertedY(true)
            .neighborYBased(false)
            .build();

    private static final Logger log = LoggerFactory.getLogger(SudokuBoard.class);

    private final Grid<Integer> grid;
    private final int boxSize;

    private SudokuBoard(Grid<Integer> grid, int boxSize) {
        this.grid = grid;
        this.boxSize = boxSize;
    }

    public static SudokuBoard of(List<? extends List<Integer>> rows) {
        Objects.requireNonNull(rows, "rows");
        for (int row = 0; row < rows.size(); row++) {
            List<Integer> values = rows.get(row);
            if (values == null || values.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Board row " + row + " is missing or has a null cell");
            }
        }
        Grid<Integer> grid;
        try {
            grid = Grids.fromRows(rows, OPTIONS);
        } catch (GridException ex) {
            throw new IllegalArgumentException("Invalid board: " + ex.getMessage(), ex);
        }
        int side = grid.rows();
        if (grid.columns() != side) {
            throw new IllegalArgumentException("Board must be square but is " + grid.columns() + "x" + side);
        }
        int boxSize = (int) Math.round(Math.sqrt(side));
        if (boxSize * boxSize != side) {
            throw new IllegalArgumentException("Board side " + side + " is not a perfect square");
        }
        for (Integer value : grid) {
            if (value < EMPTY || value > side) {
                throw new IllegalArgumentException("Cell value " + value + " is out of range 0-" + side);
            }
        }
        return new SudokuBoard(grid, boxSize);
    }

    public int side() {
        return grid.rows();
    }

    public int boxSize() {
        return boxSize;
    }

    public Optional<Integer> valueAt(Coordinates coordinates) {
        return grid.get(coordinates);
    }

    public PlacementCheck check(Coordinates coordinates, int number) {
        requireNumber(number);
        if (!grid.contains(coordinates)) {
            throw new IllegalArgumentException("Coordinates " + coordinates + " are outside the board");
        }
        boolean rowConflict = contains(grid.row(coordinates), number);
        boolean columnConflict = contains(grid.column(coordinates), number);
        boolean regionConflict = false;
        for (Optional<Integer> value : grid.region(boxSize, coordinates)) {
            if (value.isPresent() && value.get() == number) {
                regionConflict = true;
                break;
            }
        }
        PlacementCheck check = new PlacementCheck(rowConflict, columnConflict, regionConflict);
        log.debug("Placing {} at {}: {}", number, coordinates, check);
        return check;
    }

    public void place(Coordinates coordinates, int number) {
        PlacementCheck check = check(coordinates, number);
        if (!check.placeable()) {
            throw new IllegalArgumentException("Cannot place " + number + " at " + coordinates + ": " + check);
        }
        grid.set(coordinates, number);
    }

    public void clear(Coordinates coordinates) {
        if (!grid.contains(coordinates)) {
            throw new IllegalArgumentException("Coordinates " + coordinates + " are outside the board");
        }
        grid.set(coordinates, EMPTY);
    }

    public boolean isComplete() {
        return grid.stream().noneMatch(value -> value == EMPTY) && isValid();
    }

    /**
     * True when no row, column or box holds the same number twice. Empty cells are ignored.
     */
    public boolean isValid() {
        int side = side();
        for (int i = 0; i < side; i++) {
            Coordinates lineStart = new Coordinates(i, i);
            if (hasDuplicate(grid.row(lineStart)) || hasDuplicate(grid.column(lineStart))) {
                return false;
            }
        }
        for (int region = 0; region < side; region++) {
            BitSet seen = new BitSet(side + 1);
            for (Optional<Integer> value : grid.regionById(boxSize, region)) {
                if (value.isPresent() && value.get() != EMPTY && !mark(seen, value.get())) {
                    return false;
                }
            }
        }
        return true;
    }

    public List<List<Integer>> toRows() {
        List<List<Integer>> rows = new ArrayList<>(side());
        for (int row = 0; row < side(); row++) {
            List<Integer> values = new ArrayList<>(side());
            grid.row(new Coordinates(0, row)).forEach(values::add);
            rows.add(List.copyOf(values));
        }
        return List.copyOf(rows);
    }

    private void requireNumber(int number) {
        if (number < 1 || number > side()) {
            throw new IllegalArgumentException("Number " + number + " is out of range 1-" + side());
        }
    }

    private static boolean contains(Iterable<Integer> values, int number) {
        for (Integer value : values) {
            if (value == number) {
                return true;
            }
        }
        return false;
    }

    private boolean hasDuplicate(Iterable<Integer> values) {
        BitSet seen = new BitSet(side() + 1);
        for (Integer value : values) {
            if (value != EMPTY && !mark(seen, value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean mark(BitSet seen, int value) {
        if (seen.get(value)) {
            return false;
        }
        seen.set(value);
        return true;
    }
}
