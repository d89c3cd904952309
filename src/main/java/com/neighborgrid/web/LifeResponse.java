package com.neighborgrid.web;

import java.util.List;

public record LifeResponse(
        List<String> rows,
        String rule,
        int stepsRequested,
        int stepsSimulated,
        int aliveCount,
        boolean stable,
        String options
) {
}
