package com.neighborgrid.life;

import com.neighborgrid.grid.Grid;
import com.neighborgrid.grid.GridOptions;
import com.neighborgrid.grid.Grids;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Text form of life grids: one line per row, one character per cell.
 */
public final class LifePatterns {

    public static final char ALIVE = '#';
    public static final char DEAD = '.';
    private static final char COMMENT = '!';

    private LifePatterns() {
    }

    public static Grid<Boolean> parse(List<String> rows, GridOptions options) {
        Objects.requireNonNull(rows, "rows");
        List<List<Boolean>> cells = new ArrayList<>(rows.size());
        for (int row = 0; row < rows.size(); row++) {
            String line = Objects.requireNonNull(rows.get(row), "row " + row).trim();
            List<Boolean> values = new ArrayList<>(line.length());
            for (int column = 0; column < line.length(); column++) {
                values.add(parseCell(line.charAt(column), row, column));
            }
            cells.add(values);
        }
        return Grids.fromRows(cells, options);
    }

    public static Grid<Boolean> load(Path path, GridOptions options) throws IOException {
        Objects.requireNonNull(path, "path");
        List<String> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.charAt(0) == COMMENT) {
                    continue;
                }
                rows.add(trimmed);
            }
        }
        return parse(rows, options);
    }

    public static List<String> render(Grid<Boolean> grid) {
        List<String> rows = new ArrayList<>(grid.rows());
        StringBuilder line = new StringBuilder(grid.columns());
        for (Boolean alive : grid) {
            line.append(alive ? ALIVE : DEAD);
            if (line.length() == grid.columns()) {
                rows.add(line.toString());
                line.setLength(0);
            }
        }
        return rows;
    }

    public static int aliveCount(Grid<Boolean> grid) {
        int count = 0;
        for (Boolean alive : grid) {
            if (alive) {
                count++;
            }
        }
        return count;
    }

    private static boolean parseCell(char ch, int row, int column) {
        return switch (ch) {
            case '#', '1', 'O', 'o', '*' -> true;
            case '.', '0', '_' -> false;
            default -> throw new IllegalArgumentException(
                    "Invalid cell '" + ch + "' at row " + row + ", column " + column);
        };
    }
}
