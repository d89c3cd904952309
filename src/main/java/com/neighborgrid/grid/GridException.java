package com.neighborgrid.grid;

import java.util.Objects;

public class GridException extends RuntimeException {

    private final GridError error;

    public GridException(GridError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public GridException(GridError error, String detail) {
        super(Objects.requireNonNull(error, "error").message() + ": " + detail);
        this.error = error;
    }

    public GridError error() {
        return error;
    }
}
