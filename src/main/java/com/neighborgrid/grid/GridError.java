package com.neighborgrid.grid;

public enum GridError {
    INDEX_OUT_OF_BOUNDS("Index out of bounds"),
    ROW_SIZE_MISMATCH("Row size must match other rows"),
    INVALID_SIZE("Invalid grid size"),
    EXCESSIVE_SIZE("Resulting grid is too large"),
    INVALID_DIVISION_SIZE("Divisor is either less than 1 or larger than the grid");

    private final String message;

    GridError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
