package com.neighborgrid.grid;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The four cardinal neighbors of a cell. Iterates up, left, right, down; a missing neighbor is an
 * empty {@code Optional}.
 */
public final class XyNeighbors<T> implements Iterable<Optional<T>> {

    private final T up;
    private final T left;
    private final T right;
    private final T down;

    XyNeighbors(T up, T left, T right, T down) {
        this.up = up;
        this.left = left;
        this.right = right;
        this.down = down;
    }

    public Optional<T> up() {
        return Optional.ofNullable(up);
    }

    public Optional<T> left() {
        return Optional.ofNullable(left);
    }

    public Optional<T> right() {
        return Optional.ofNullable(right);
    }

    public Optional<T> down() {
        return Optional.ofNullable(down);
    }

    public List<Optional<T>> asList() {
        return List.of(up(), left(), right(), down());
    }

    public int presentCount() {
        return countMatching(value -> true);
    }

    public int countMatching(Predicate<? super T> predicate) {
        int count = 0;
        for (T neighbor : Arrays.asList(up, left, right, down)) {
            if (neighbor != null && predicate.test(neighbor)) {
                count++;
            }
        }
        return count;
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
        if (!(obj instanceof XyNeighbors<?> other)) {
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
        return "XyNeighbors[up=" + up + ", left=" + left + ", right=" + right + ", down=" + down + "]";
    }
}
