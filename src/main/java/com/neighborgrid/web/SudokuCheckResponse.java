package com.neighborgrid.web;

public record SudokuCheckResponse(
        boolean placeable,
        boolean rowConflict,
        boolean columnConflict,
        boolean regionConflict,
        boolean boardValid
) {
}
