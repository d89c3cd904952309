package com.neighborgrid.life;

import static org.junit.jupiter.api.Assertions.*;

import com.neighborgrid.grid.Grid;
import com.neighborgrid.grid.GridOptions;
import java.util.List;
import org.junit.jupiter.api.Test;

class LifeSimulationTest {

    private final LifeSimulation simulation = new LifeSimulation();
    private final GridOptions torus = GridOptions.builder().wrap(true).build();

    private Grid<Boolean> glider() {
        return LifePatterns.parse(List.of(
                ".#...",
                "..##.",
                ".##..",
                ".....",
                "....."), torus);
    }

    @Test
    void gliderAdvancesOneGeneration() {
        Grid<Boolean> next = simulation.advance(glider(), LifeRule.defaultLife());
        assertEquals(List.of(
                "..#..",
                "...#.",
                ".###.",
                ".....",
                "....."), LifePatterns.render(next));
    }

    @Test
    void gliderTravelsAcrossTorusForTenGenerations() {
        LifeRun run = simulation.run(glider(), LifeRule.defaultLife(), 10);
        assertEquals(List.of(
                "....#",
                ".....",
                ".....",
                "#..#.",
                "#...#"), LifePatterns.render(run.finalGrid()));
        assertEquals(10, run.stepsRequested());
        assertEquals(10, run.stepsSimulated());
        assertEquals(5, run.aliveCount());
        assertFalse(run.stable());
    }

    @Test
    void gliderRepeatsShiftedAfterFourGenerations() {
        Grid<Boolean> current = simulation.advance(glider(), LifeRule.defaultLife());
        for (int generation = 0; generation < 4; generation++) {
            current = simulation.advance(current, LifeRule.defaultLife());
        }
        assertEquals(List.of(
                ".....",
                "...#.",
                "....#",
                "..###",
                "....."), LifePatterns.render(current));
    }

    @Test
    void blinkerOscillatesWithoutWrap() {
        Grid<Boolean> blinker = LifePatterns.parse(List.of(
                ".....",
                "..#..",
                "..#..",
                "..#..",
                "....."), GridOptions.defaults());
        Grid<Boolean> first = simulation.advance(blinker, LifeRule.defaultLife());
        assertEquals(List.of(
                ".....",
                ".....",
                ".###.",
                ".....",
                "....."), LifePatterns.render(first));

        LifeRun run = simulation.run(blinker, LifeRule.defaultLife(), 2);
        assertEquals(blinker, run.finalGrid());
        assertFalse(run.stable());
    }

    @Test
    void stillLifeStopsEarly() {
        Grid<Boolean> block = LifePatterns.parse(List.of(
                "....",
                ".##.",
                ".##.",
                "...."), GridOptions.defaults());
        LifeRun run = simulation.run(block, LifeRule.defaultLife(), 50);
        assertTrue(run.stable());
        assertEquals(1, run.stepsSimulated());
        assertEquals(50, run.stepsRequested());
        assertEquals(4, run.aliveCount());
    }

    @Test
    void runLeavesInitialGridUntouched() {
        Grid<Boolean> initial = glider();
        Grid<Boolean> snapshot = initial.copy();
        simulation.run(initial, LifeRule.defaultLife(), 3);
        assertEquals(snapshot, initial);
    }

    @Test
    void stepsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> simulation.run(glider(), LifeRule.defaultLife(), 0));
    }
}
