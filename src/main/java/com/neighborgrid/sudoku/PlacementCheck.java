package com.neighborgrid.sudoku;

public record PlacementCheck(boolean rowConflict, boolean columnConflict, boolean regionConflict) {

    public boolean placeable() {
        return !rowConflict && !columnConflict && !regionConflict;
    }
}
