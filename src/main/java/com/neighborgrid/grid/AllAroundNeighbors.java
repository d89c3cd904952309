package com.neighborgrid.grid;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The eight surrounding cells of a cell, top to bottom and left to right: upLeft, up, upRight,
 * left, right, downLeft, down, downRight.
 */
public final class AllAroundNeighbors<T> implements Iterable<Optional<T>> {

    private final T upLeft;
    private final T up;
    private final T upRight;
    private final T left;
    private final T right;
    private final T downLeft;
    private final T down;
    private final T downRight;

    AllAroundNeighbors(T upLeft, T up, T upRight, T left, T right, T downLeft, T down, T downRight) {
        this.upLeft = upLeft;
        this.up = up;
        this.upRight = upRight;
        this.left = left;
        this.right = right;
        this.downLeft = downLeft;
        this.down = down;
        this.downRight = downRight;
    }

    public Optional<T> upLeft() {
        return Optional.ofNullable(upLeft);
    }

    public Optional<T> up() {
        return Optional.ofNullable(up);
    }

    public Optional<T> upRight() {
        return Optional.ofNullable(upRight);
    }

    public Optional<T> left() {
        return Optional.ofNullable(left);
    }

    public Optional<T> right() {
        return Optional.ofNullable(right);
    }

    public Optional<T> downLeft() {
        return Optional.ofNullable(downLeft);
    }

    public Optional<T> down() {
        return Optional.ofNullable(down);
    }

    public Optional<T> downRight() {
        return Optional.ofNullable(downRight);
    }

    public Optional<T> get(Direction direction) {
        return Optional.ofNullable(raw(direction));
    }

    public List<Optional<T>> asList() {
        return List.of(upLeft(), up(), upRight(), left(), right(), downLeft(), down(), downRight());
    }

    public int presentCount() {
        return countMatching(value -> true);
    }

    public int countMatching(Predicate<? super T> predicate) {
        int count = 0;
        for (T neighbor : Arrays.asList(upLeft, up, upRight, left, right, downLeft, down, downRight)) {
            if (neighbor != null && predicate.test(neighbor)) {
                count++;
            }
        }
        return count;
    }

    private T raw(Direction direction) {
        return switch (direction) {
            case UP_LEFT -> upLeft;
            case UP -> up;
            case UP_RIGHT -> upRight;
            case LEFT -> left;
            case RIGHT -> right;
            case DOWN_LEFT -> downLeft;
            case DOWN -> down;
            case DOWN_RIGHT -> downRight;
        };
    }

    @Override
    public Iterator<Optional<T>> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AllAroundNeighbors<?> other)) {
            return false;
        }
        return asList().equals(other.asList());
    }

    @Override
    public int hashCode() {
        return asList().hashCode();
    }

    @Override
    public String toString() {
        return "AllAroundNeighbors" + asList();
    }
}
