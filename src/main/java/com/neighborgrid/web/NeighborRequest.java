package com.neighborgrid.web;

import java.util.List;

public record NeighborRequest(
        List<List<Integer>> rows,
        Integer x,
        Integer y,
        GridOptionsDto options
) {
}
