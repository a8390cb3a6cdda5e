package ai.puzzles.game;

/**
 * A grid coordinate. Column {@code x} grows to the right, row {@code y} grows downwards.
 *
 * <p>Tiles carry no bounds of their own; whether a tile lies on the grid is decided by
 * {@link Board#tileExists(Tile)}.
 */
public record Tile(int x, int y) {

    public Tile {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Tile coordinates must be non-negative: (" + x + "," + y + ")");
        }
    }

    /**
     * Returns the tile {@code dx} columns and {@code dy} rows away from this one.
     *
     * @throws IllegalArgumentException if the result would leave the non-negative quadrant
     */
    public Tile offset(int dx, int dy) {
        return new Tile(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
