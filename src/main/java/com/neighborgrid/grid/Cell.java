package com.neighborgrid.grid;

/**
 * Writable handle on one cell, handed out by the mutable traversals of {@link Grid}.
 *
 * <p>A handle stays bound to its offset. While mutable handles of a grid are in use the caller must
 * not read or write that grid by other means.
 */
public interface Cell<T> {

    int offset();

    T get();

    void set(T value);
}
