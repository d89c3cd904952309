package com.neighborgrid.grid;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.IntFunction;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A 2-D grid with the same number of cells in every row, stored row-major in one array.
 *
 * <p>Cells are addressed through any {@link GridIndex}: a flat {@link Offset}, a {@link Point} or
 * {@link Coordinates}, all interpreted through the grid's {@link GridOptions}. Lookups that may
 * legitimately miss ({@code get}, neighbor getters, traversals) report a miss as an empty result;
 * explicit resolution and mutation throw {@link GridException}. Cells are never {@code null}.
 *
 * <p>Grids are created through {@link Grids}.
 */
public final class Grid<T> implements Iterable<T> {

    private final GridGeometry geometry;
    private final Object[] items;

    Grid(GridGeometry geometry, Object[] items) {
        if (items.length != geometry.size()) {
            throw new GridException(GridError.INVALID_SIZE,
                    items.length + " items for " + geometry.rows() + "x" + geometry.columns());
        }
        for (Object item : items) {
            Objects.requireNonNull(item, "grid cells must not be null");
        }
        this.geometry = geometry;
        this.items = items;
    }

    public GridGeometry geometry() {
        return geometry;
    }

    public GridOptions options() {
        return geometry.options();
    }

    public int rows() {
        return geometry.rows();
    }

    public int columns() {
        return geometry.columns();
    }

    public int size() {
        return items.length;
    }

    public int minX() {
        return CoordinateSystem.minX(geometry);
    }

    public int maxX() {
        return CoordinateSystem.maxX(geometry);
    }

    public int minY() {
        return CoordinateSystem.minY(geometry);
    }

    public int maxY() {
        return CoordinateSystem.maxY(geometry);
    }

    /**
     * Resolves any coordinate form to its canonical offset.
     *
     * @throws GridException with {@link GridError#INDEX_OUT_OF_BOUNDS} when the location is outside
     *     the grid
     */
    public int offsetOf(GridIndex index) {
        return Objects.requireNonNull(index, "index").resolve(geometry);
    }

    public <I extends GridIndex> I indexOf(int offset, IndexFactory<I> factory) {
        return geometry.materialize(offset, factory);
    }

    public boolean contains(GridIndex index) {
        return tryResolve(index).isPresent();
    }

    public Optional<T> get(GridIndex index) {
        OptionalInt offset = tryResolve(index);
        return offset.isPresent() ? Optional.of(cell(offset.getAsInt())) : Optional.empty();
    }

    public Optional<T> get(int offset) {
        return get(Offset.of(offset));
    }

    public Optional<T> get(int x, int y) {
        return get(Point.of(x, y));
    }

    /**
     * Replaces a cell and returns the previous value.
     */
    public T set(GridIndex index, T value) {
        Objects.requireNonNull(value, "value");
        int offset = offsetOf(index);
        T previous = cell(offset);
        items[offset] = value;
        return previous;
    }

    public T set(int x, int y, T value) {
        return set(Point.of(x, y), value);
    }

    public void swap(GridIndex a, GridIndex b) {
        int first = offsetOf(a);
        int second = offsetOf(b);
        Object held = items[first];
        items[first] = items[second];
        items[second] = held;
    }

    public void replaceAll(UnaryOperator<T> operator) {
        Objects.requireNonNull(operator, "operator");
        for (int i = 0; i < items.length; i++) {
            items[i] = Objects.requireNonNull(operator.apply(cell(i)), "replacement value");
        }
    }

    public Optional<T> neighbor(GridIndex index, Direction direction) {
        OptionalInt offset = neighborIndex(index, direction);
        return offset.isPresent() ? Optional.of(cell(offset.getAsInt())) : Optional.empty();
    }

    /**
     * Offset of the neighbor in {@code direction}, or empty when the start is outside the grid or the
     * move runs off a non-wrapping edge.
     */
    public OptionalInt neighborIndex(GridIndex index, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        OptionalInt start = tryResolve(index);
        if (start.isEmpty()) {
            return start;
        }
        return NeighborResolver.neighbor(geometry, start.getAsInt(), direction);
    }

    public Optional<T> getUp(GridIndex index) {
        return neighbor(index, Direction.UP);
    }

    public Optional<T> getDown(GridIndex index) {
        return neighbor(index, Direction.DOWN);
    }

    public Optional<T> getLeft(GridIndex index) {
        return neighbor(index, Direction.LEFT);
    }

    public Optional<T> getRight(GridIndex index) {
        return neighbor(index, Direction.RIGHT);
    }

    public Optional<T> getUpLeft(GridIndex index) {
        return neighbor(index, Direction.UP_LEFT);
    }

    public Optional<T> getUpRight(GridIndex index) {
        return neighbor(index, Direction.UP_RIGHT);
    }

    public Optional<T> getDownLeft(GridIndex index) {
        return neighbor(index, Direction.DOWN_LEFT);
    }

    public Optional<T> getDownRight(GridIndex index) {
        return neighbor(index, Direction.DOWN_RIGHT);
    }

    public XyNeighbors<T> xyNeighbors(GridIndex index) {
        Offset start = Offset.of(offsetOf(index));
        return new XyNeighbors<>(
                neighborOrNull(start, Direction.UP),
                neighborOrNull(start, Direction.LEFT),
                neighborOrNull(start, Direction.RIGHT),
                neighborOrNull(start, Direction.DOWN));
    }

    public AllAroundNeighbors<T> allAroundNeighbors(GridIndex index) {
        Offset start = Offset.of(offsetOf(index));
        return new AllAroundNeighbors<>(
                neighborOrNull(start, Direction.UP_LEFT),
                neighborOrNull(start, Direction.UP),
                neighborOrNull(start, Direction.UP_RIGHT),
                neighborOrNull(start, Direction.LEFT),
                neighborOrNull(start, Direction.RIGHT),
                neighborOrNull(start, Direction.DOWN_LEFT),
                neighborOrNull(start, Direction.DOWN),
                neighborOrNull(start, Direction.DOWN_RIGHT));
    }

    private T neighborOrNull(Offset start, Direction direction) {
        OptionalInt offset = NeighborResolver.neighbor(geometry, start.value(), direction);
        return offset.isPresent() ? cell(offset.getAsInt()) : null;
    }

    /**
     * Which of the {@code divisor * divisor} regions the index falls in, numbered row-major. Region
     * extents use ceiling division, so for a 9x9 Sudoku board a divisor of 3 yields the nine boxes.
     */
    public long nrant(GridIndex index, int divisor) {
        Partitioner.requireDivisor(geometry, divisor);
        return Partitioner.regionOf(geometry, offsetOf(index), divisor);
    }

    public int quadrant(GridIndex index) {
        return (int) nrant(index, 2);
    }

    public Iterable<T> row(GridIndex index) {
        OptionalInt start = tryResolve(index);
        Traversal traversal = start.isPresent() ? Traversal.row(geometry, start.getAsInt()) : Traversal.empty();
        return iterable(traversal, this::cell, null);
    }

    public Iterable<T> column(GridIndex index) {
        OptionalInt start = tryResolve(index);
        Traversal traversal = start.isPresent() ? Traversal.column(geometry, start.getAsInt()) : Traversal.empty();
        return iterable(traversal, this::cell, null);
    }

    /**
     * Slots of the region holding {@code index}, always {@code regionWidth * regionHeight} of them;
     * slots past a ragged edge are empty. An index outside the grid gives an empty iterable.
     *
     * @throws GridException with {@link GridError#INVALID_DIVISION_SIZE} for a bad divisor
     */
    public Iterable<Optional<T>> region(int divisor, GridIndex index) {
        return iterable(regionTraversal(divisor, index), offset -> Optional.of(cell(offset)), Optional.empty());
    }

    public Iterable<Optional<T>> quadrantRegion(GridIndex index) {
        return region(2, index);
    }

    public Iterable<Optional<T>> regionById(int divisor, long regionId) {
        Traversal traversal = Traversal.region(geometry, divisor, regionId);
        return iterable(traversal, offset -> Optional.of(cell(offset)), Optional.empty());
    }

    public Iterable<Cell<T>> rowCells(GridIndex index) {
        OptionalInt start = tryResolve(index);
        Traversal traversal = start.isPresent() ? Traversal.row(geometry, start.getAsInt()) : Traversal.empty();
        return iterable(traversal, GridCell::new, null);
    }

    public Iterable<Cell<T>> columnCells(GridIndex index) {
        OptionalInt start = tryResolve(index);
        Traversal traversal = start.isPresent() ? Traversal.column(geometry, start.getAsInt()) : Traversal.empty();
        return iterable(traversal, GridCell::new, null);
    }

    public Iterable<Optional<Cell<T>>> regionCells(int divisor, GridIndex index) {
        return iterable(regionTraversal(divisor, index), offset -> Optional.of(new GridCell(offset)), Optional.empty());
    }

    public Iterable<T> values() {
        return iterable(Traversal.all(geometry), this::cell, null);
    }

    @Override
    public Iterator<T> iterator() {
        return values().iterator();
    }

    @SuppressWarnings("unchecked")
    public Stream<T> stream() {
        return Arrays.stream(items).map(item -> (T) item);
    }

    public Grid<T> copy() {
        return new Grid<>(geometry, Arrays.copyOf(items, items.length));
    }

    private Traversal regionTraversal(int divisor, GridIndex index) {
        Partitioner.requireDivisor(geometry, divisor);
        OptionalInt start = tryResolve(index);
        if (start.isEmpty()) {
            return Traversal.empty();
        }
        long regionId = Partitioner.regionOf(geometry, start.getAsInt(), divisor);
        return Traversal.region(geometry, divisor, regionId);
    }

    private OptionalInt tryResolve(GridIndex index) {
        Objects.requireNonNull(index, "index");
        try {
            return OptionalInt.of(index.resolve(geometry));
        } catch (GridException ex) {
            if (ex.error() != GridError.INDEX_OUT_OF_BOUNDS) {
                throw ex;
            }
            return OptionalInt.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private T cell(int offset) {
        return (T) items[offset];
    }

    private static <R> Iterable<R> iterable(Traversal traversal, IntFunction<R> present, R absent) {
        return () -> new Iterator<>() {
            private int slot;

            @Override
            public boolean hasNext() {
                return slot < traversal.length();
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int offset = traversal.offsetAt(slot++);
                return offset == Traversal.ABSENT ? absent : present.apply(offset);
            }
        };
    }

    private final class GridCell implements Cell<T> {
        private final int offset;

        private GridCell(int offset) {
            this.offset = offset;
        }

        @Override
        public int offset() {
            return offset;
        }

        @Override
        public T get() {
            return cell(offset);
        }

        @Override
        public void set(T value) {
            items[offset] = Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "Cell[" + offset + "=" + get() + "]";
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Grid<?> other)) {
            return false;
        }
        return geometry.equals(other.geometry) && Arrays.equals(items, other.items);
    }

    @Override
    public int hashCode() {
        int result = geometry.hashCode();
        result = 31 * result + Arrays.hashCode(items);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Grid[")
                .append(columns()).append('x').append(rows())
                .append(", ").append(options().serialize()).append("]\n");
        for (int row = 0; row < rows(); row++) {
            for (int column = 0; column < columns(); column++) {
                if (column > 0) {
                    builder.append(' ');
                }
                builder.append(items[row * columns() + column]);
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
