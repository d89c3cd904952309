package com.neighborgrid.web;

import java.util.List;

public record LifeRequest(
        List<String> rows,
        String rule,
        Integer steps,
        GridOptionsDto options
) {
}
