package com.neighborgrid.web;

import java.util.List;

public record SudokuCheckRequest(
        List<List<Integer>> board,
        Integer column,
        Integer row,
        Integer number
) {
}
