package com.neighborgrid.life;

import com.neighborgrid.grid.AllAroundNeighbors;
import com.neighborgrid.grid.Grid;
import com.neighborgrid.grid.Offset;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LifeSimulation {

    private static final Logger log = LoggerFactory.getLogger(LifeSimulation.class);

    /**
     * Next generation of {@code current}. Edge behavior follows the grid's wrap options: a wrapping
     * grid is a torus, a bounded one treats cells past the edge as dead.
     */
    public Grid<Boolean> advance(Grid<Boolean> current, LifeRule rule) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(rule, "rule");
        Grid<Boolean> next = current.copy();
        for (int offset = 0; offset < current.size(); offset++) {
            Offset cell = Offset.of(offset);
            AllAroundNeighbors<Boolean> neighbors = current.allAroundNeighbors(cell);
            int alive = neighbors.countMatching(Boolean::booleanValue);
            boolean currentlyAlive = current.get(cell).orElse(false);
            next.set(cell, rule.shouldLive(currentlyAlive, alive));
        }
        return next;
    }

    public LifeRun run(Grid<Boolean> initial, LifeRule rule, int steps) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(rule, "rule");
        if (steps <= 0) {
            throw new IllegalArgumentException("Steps must be positive");
        }
        long start = System.nanoTime();
        Grid<Boolean> current = initial.copy();
        int stepsSimulated = 0;
        boolean stable = false;
        for (int step = 0; step < steps; step++) {
            Grid<Boolean> next = advance(current, rule);
            stepsSimulated = step + 1;
            if (log.isDebugEnabled()) {
                log.debug("Generation {}: {} alive", stepsSimulated, LifePatterns.aliveCount(next));
            }
            if (next.equals(current)) {
                stable = true;
                break;
            }
            current = next;
        }
        int alive = LifePatterns.aliveCount(current);
        Duration spent = Duration.ofNanos(System.nanoTime() - start);
        log.info(
                "Life {} on {}x{} [{}]: {} of {} steps, {} alive{} (spent={})",
                rule.label(),
                current.columns(),
                current.rows(),
                current.options().serialize(),
                stepsSimulated,
                steps,
                alive,
                stable ? ", stable" : "",
                String.format(Locale.US, "%.1f ms", spent.toNanos() / 1_000_000.0));
        return new LifeRun(current, rule, steps, stepsSimulated, alive, stable);
    }
}
