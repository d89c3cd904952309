package com.neighborgrid.web;

import com.neighborgrid.config.AppProperties;
import com.neighborgrid.grid.AllAroundNeighbors;
import com.neighborgrid.grid.Coordinates;
import com.neighborgrid.grid.Grid;
import com.neighborgrid.grid.GridException;
import com.neighborgrid.grid.GridOptions;
import com.neighborgrid.grid.Grids;
import com.neighborgrid.grid.Point;
import com.neighborgrid.life.LifePatterns;
import com.neighborgrid.life.LifeRule;
import com.neighborgrid.life.LifeRun;
import com.neighborgrid.life.LifeSimulation;
import com.neighborgrid.sudoku.PlacementCheck;
import com.neighborgrid.sudoku.SudokuBoard;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
public class GridDemoController {

    private static final Logger log = LoggerFactory.getLogger(GridDemoController.class);

    private final LifeSimulation lifeSimulation;
    private final AppProperties properties;

    public GridDemoController(LifeSimulation lifeSimulation, AppProperties properties) {
        this.lifeSimulation = lifeSimulation;
        this.properties = properties;
    }

    @PostMapping(path = "/life/advance", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public LifeResponse advanceLife(@RequestBody LifeRequest request) {
        if (request.rows() == null || request.rows().isEmpty() || request.rows().stream().anyMatch(Objects::isNull)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "rows are required and must not contain null");
        }
        LifeRule rule = parseRule(request.rule());
        int steps = request.steps() != null ? request.steps() : 1;
        if (steps <= 0 || steps > properties.getLifeMaxSteps()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "steps must be between 1 and " + properties.getLifeMaxSteps());
        }
        GridOptions options = toOptions(request.options());

        Grid<Boolean> initial;
        try {
            initial = LifePatterns.parse(request.rows(), options);
        } catch (GridException | IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid pattern: " + ex.getMessage(), ex);
        }

        LifeRun run = lifeSimulation.run(initial, rule, steps);
        return new LifeResponse(
                LifePatterns.render(run.finalGrid()),
                run.rule().label(),
                run.stepsRequested(),
                run.stepsSimulated(),
                run.aliveCount(),
                run.stable(),
                options.serialize());
    }

    @PostMapping(path = "/sudoku/check", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public SudokuCheckResponse checkSudoku(@RequestBody SudokuCheckRequest request) {
        if (request.board() == null || request.column() == null || request.row() == null || request.number() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "board, column, row and number are required");
        }
        requireCells(request.board(), "board");
        SudokuBoard board;
        PlacementCheck check;
        try {
            board = SudokuBoard.of(request.board());
            check = board.check(new Coordinates(request.column(), request.row()), request.number());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        log.info("Sudoku check {} at ({}, {}): {}", request.number(), request.column(), request.row(),
                check.placeable() ? "placeable" : "blocked");
        return new SudokuCheckResponse(
                check.placeable(),
                check.rowConflict(),
                check.columnConflict(),
                check.regionConflict(),
                board.isValid());
    }

    @PostMapping(path = "/grid/neighbors", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public NeighborResponse neighbors(@RequestBody NeighborRequest request) {
        if (request.rows() == null || request.x() == null || request.y() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "rows, x and y are required");
        }
        requireCells(request.rows(), "rows");
        GridOptions options = toOptions(request.options());
        Point point = Point.of(request.x(), request.y());
        try {
            Grid<Integer> grid = Grids.fromRows(request.rows(), options);
            int offset = grid.offsetOf(point);
            AllAroundNeighbors<Integer> around = grid.allAroundNeighbors(point);
            Integer quadrant = Math.max(grid.rows(), grid.columns()) >= 2 ? grid.quadrant(point) : null;
            return new NeighborResponse(
                    grid.get(point).orElseThrow(),
                    offset,
                    quadrant,
                    orNull(around.upLeft()),
                    orNull(around.up()),
                    orNull(around.upRight()),
                    orNull(around.left()),
                    orNull(around.right()),
                    orNull(around.downLeft()),
                    orNull(around.down()),
                    orNull(around.downRight()),
                    options.serialize());
        } catch (GridException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    private static void requireCells(List<List<Integer>> rows, String field) {
        for (int row = 0; row < rows.size(); row++) {
            List<Integer> cells = rows.get(row);
            if (cells == null || cells.stream().anyMatch(Objects::isNull)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        field + " row " + row + " is missing or has an empty cell");
            }
        }
    }

    private LifeRule parseRule(String raw) {
        if (!StringUtils.hasText(raw)) {
            return properties.getLifeDefaultRule();
        }
        try {
            return LifeRule.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid rule: " + ex.getMessage(), ex);
        }
    }

    private GridOptions toOptions(GridOptionsDto dto) {
        if (dto == null) {
            return GridOptions.defaults();
        }
        try {
            return dto.toOptions(GridOptions.defaults());
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid options: " + ex.getMessage(), ex);
        }
    }

    private static Integer orNull(Optional<Integer> value) {
        return value.orElse(null);
    }
}
