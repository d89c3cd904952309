package com.neighborgrid.life;

import com.neighborgrid.grid.Grid;

public record LifeRun(
        Grid<Boolean> finalGrid,
        LifeRule rule,
        int stepsRequested,
        int stepsSimulated,
        int aliveCount,
        boolean stable
) {
    public LifeRun {
        finalGrid = finalGrid.copy();
    }

    @Override
    public Grid<Boolean> finalGrid() {
        return finalGrid.copy();
    }
}
