package com.neighborgrid.grid;

/**
 * Splits a grid into a {@code divisor x divisor} arrangement of regions ("nrants").
 *
 * <p>Region extents use ceiling division, so regions along the bottom and right edges are smaller
 * when the grid does not divide evenly. Regions are numbered row-major and always work on the
 * canonical layout: origin and axis inversion play no part.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static int requireDivisor(GridGeometry geometry, int divisor) {
        if (divisor < 1 || divisor > Math.max(geometry.rows(), geometry.columns())) {
            throw new GridException(GridError.INVALID_DIVISION_SIZE,
                    "divisor " + divisor + " for " + geometry.columns() + "x" + geometry.rows() + " grid");
        }
        return divisor;
    }

    public static int regionWidth(GridGeometry geometry, int divisor) {
        return ceiling(geometry.columns(), requireDivisor(geometry, divisor));
    }

    public static int regionHeight(GridGeometry geometry, int divisor) {
        return ceiling(geometry.rows(), requireDivisor(geometry, divisor));
    }

    public static long regionOf(GridGeometry geometry, int offset, int divisor) {
        int width = regionWidth(geometry, divisor);
        int height = regionHeight(geometry, divisor);
        geometry.requireOffset(offset);
        long rowBlock = geometry.rowOf(offset) / height;
        long columnBlock = geometry.columnOf(offset) / width;
        return rowBlock * divisor + columnBlock;
    }

    public static long regionStartRow(GridGeometry geometry, long regionId, int divisor) {
        requireRegion(geometry, regionId, divisor);
        return regionId / divisor * regionHeight(geometry, divisor);
    }

    public static long regionStartColumn(GridGeometry geometry, long regionId, int divisor) {
        requireRegion(geometry, regionId, divisor);
        return regionId % divisor * regionWidth(geometry, divisor);
    }

    /**
     * First canonical offset of a region. For a region that lies entirely past the grid edge (possible
     * when ceiling extents overshoot) the result is not a valid offset.
     */
    public static long regionStart(GridGeometry geometry, long regionId, int divisor) {
        return regionStartRow(geometry, regionId, divisor) * geometry.columns()
                + regionStartColumn(geometry, regionId, divisor);
    }

    /**
     * Number of regions, {@code divisor * divisor}. A divisor may be as large as the longer side, so
     * the count can exceed the {@code int} range on long, thin grids.
     */
    public static long regionCount(GridGeometry geometry, int divisor) {
        requireDivisor(geometry, divisor);
        return (long) divisor * divisor;
    }

    public static long requireRegion(GridGeometry geometry, long regionId, int divisor) {
        long count = regionCount(geometry, divisor);
        if (regionId < 0 || regionId >= count) {
            throw new GridException(GridError.INDEX_OUT_OF_BOUNDS,
                    "region " + regionId + " not in [0, " + count + ")");
        }
        return regionId;
    }

    static int ceiling(int a, int b) {
        return (a + b - 1) / b;
    }
}
