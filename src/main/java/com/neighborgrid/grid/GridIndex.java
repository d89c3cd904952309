package com.neighborgrid.grid;

/**
 * A location on a grid in one of the supported coordinate forms.
 *
 * <p>{@link #resolve} either returns an offset that is safe for direct storage access or throws;
 * there is no partially validated result. The reverse direction is provided by an
 * {@link IndexFactory}.
 */
public interface GridIndex {

    int resolve(GridGeometry geometry);
}
