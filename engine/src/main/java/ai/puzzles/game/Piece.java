package ai.puzzles.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A rigid block on the puzzle grid.
 * <p>
 * A piece is described by its minimum-coordinate endpoint ({@link #getLocation()}), its
 * length and the axis it lies on. Exactly the marked piece has to reach the goal tile.
 * Pieces are immutable; sliding a piece produces a new instance via {@link #movedTo(Tile)}.
 */
public final class Piece {
    /** Minimum-coordinate endpoint (leftmost tile for horizontal, topmost for vertical). */
    private final Tile location;
    /** Number of tiles covered, at least one. */
    private final int size;
    /** Axis the piece lies on and slides along. */
    private final Direction direction;
    /** Whether this is the piece that has to reach the goal. */
    private final boolean marked;

    private Piece(Tile location, int size, Direction direction, boolean marked) {
        this.location = Objects.requireNonNull(location, "location");
        this.direction = Objects.requireNonNull(direction, "direction");
        if (size < 1) {
            throw new IllegalArgumentException("Piece size must be at least 1: " + size);
        }
        this.size = size;
        this.marked = marked;
    }

    /**
     * Creates an ordinary (unmarked) piece.
     *
     * @param location  minimum-coordinate endpoint of the piece
     * @param size      number of tiles covered
     * @param direction axis of the piece
     * @return the new piece
     * @throws IllegalArgumentException if size is less than one
     */
    public static Piece of(Tile location, int size, Direction direction) {
        return new Piece(location, size, direction, false);
    }

    /**
     * Creates the marked piece, the one that has to reach the goal tile.
     *
     * @param location  minimum-coordinate endpoint of the piece
     * @param size      number of tiles covered
     * @param direction axis of the piece
     * @return the new marked piece
     * @throws IllegalArgumentException if size is less than one
     */
    public static Piece marked(Tile location, int size, Direction direction) {
        return new Piece(location, size, direction, true);
    }

    public Tile getLocation() {
        return location;
    }

    public int getSize() {
        return size;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isMarked() {
        return marked;
    }

    /**
     * Returns the tiles covered by this piece, starting at the location and stepping along
     * the piece's axis.
     *
     * @return an unmodifiable list of exactly {@link #getSize()} tiles
     */
    public List<Tile> occupies() {
        List<Tile> tiles = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            tiles.add(direction == Direction.HORIZONTAL ? location.offset(i, 0) : location.offset(0, i));
        }
        return Collections.unmodifiableList(tiles);
    }

    /**
     * Returns the tile at the far end of the piece (equal to the location for size one).
     */
    public Tile endTile() {
        return direction == Direction.HORIZONTAL
                ? location.offset(size - 1, 0)
                : location.offset(0, size - 1);
    }

    /**
     * Returns a copy of this piece relocated to {@code newLocation}.
     *
     * @param newLocation the new minimum-coordinate endpoint
     * @return a piece with the same size, axis and marked flag
     */
    public Piece movedTo(Tile newLocation) {
        return new Piece(newLocation, size, direction, marked);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Piece)) {
            return false;
        }
        Piece other = (Piece) o;
        return size == other.size
                && marked == other.marked
                && direction == other.direction
                && location.equals(other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, size, direction, marked);
    }

    @Override
    public String toString() {
        return (marked ? "Marked" : "Piece") + location + " " + direction.name().toLowerCase(Locale.ROOT) + " x" + size;
    }
}
