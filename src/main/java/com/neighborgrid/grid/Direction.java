package com.neighborgrid.grid;

public enum Direction {
    UP_LEFT(Step.UP, Step.LEFT),
    UP(Step.UP, Step.NONE),
    UP_RIGHT(Step.UP, Step.RIGHT),
    LEFT(Step.NONE, Step.LEFT),
    RIGHT(Step.NONE, Step.RIGHT),
    DOWN_LEFT(Step.DOWN, Step.LEFT),
    DOWN(Step.DOWN, Step.NONE),
    DOWN_RIGHT(Step.DOWN, Step.RIGHT);

    private final Step vertical;
    private final Step horizontal;

    Direction(Step vertical, Step horizontal) {
        this.vertical = vertical;
        this.horizontal = horizontal;
    }

    public Step vertical() {
        return vertical;
    }

    public Step horizontal() {
        return horizontal;
    }

    public Direction opposite() {
        return switch (this) {
            case UP_LEFT -> DOWN_RIGHT;
            case UP -> DOWN;
            case UP_RIGHT -> DOWN_LEFT;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case DOWN_LEFT -> UP_RIGHT;
            case DOWN -> UP;
            case DOWN_RIGHT -> UP_LEFT;
        };
    }

    /**
     * One component of a move. {@code UP} and {@code DOWN} are in the public naming, which may
     * differ from storage row order depending on the grid options.
     */
    public enum Step {
        NONE,
        UP,
        DOWN,
        LEFT,
        RIGHT
    }
}
