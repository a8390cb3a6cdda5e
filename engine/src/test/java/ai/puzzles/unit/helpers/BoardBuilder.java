package ai.puzzles.unit.helpers;

import ai.puzzles.game.Board;
import ai.puzzles.game.Direction;
import ai.puzzles.game.Piece;
import ai.puzzles.game.Tile;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fluent builder for constructing boards in tests.
 *
 * <p>{@link Board} trusts its input; this builder does not. {@link #build()} rejects
 * overlapping pieces and pieces hanging off the grid, so a typo in a test layout fails loudly
 * instead of producing a misleading search result.
 *
 * <pre>{@code
 * Board board = BoardBuilder
 *     .newBoard(4, 4)
 *     .goal(3, 1)
 *     .marked(0, 1, 2, Direction.HORIZONTAL)
 *     .vertical(2, 0, 2)
 *     .build();
 * }</pre>
 *
 * Pieces keep the order in which they are added.
 */
public final class BoardBuilder {

    private final int width;
    private final int height;
    private Tile goal;
    private final List<Piece> pieces = new ArrayList<>();

    private BoardBuilder(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public static BoardBuilder newBoard(int width, int height) {
        return new BoardBuilder(width, height);
    }

    public BoardBuilder goal(int x, int y) {
        this.goal = new Tile(x, y);
        return this;
    }

    public BoardBuilder marked(int x, int y, int size, Direction direction) {
        pieces.add(Piece.marked(new Tile(x, y), size, direction));
        return this;
    }

    public BoardBuilder horizontal(int x, int y, int size) {
        pieces.add(Piece.of(new Tile(x, y), size, Direction.HORIZONTAL));
        return this;
    }

    public BoardBuilder vertical(int x, int y, int size) {
        pieces.add(Piece.of(new Tile(x, y), size, Direction.VERTICAL));
        return this;
    }

    /**
     * Builds the board after checking that the layout is well formed.
     *
     * @throws IllegalStateException if the goal is missing or off the grid, or a piece
     *         overlaps another piece or leaves the grid
     */
    public Board build() {
        if (goal == null) {
            throw new IllegalStateException("Goal tile not set");
        }
        if (goal.x() >= width || goal.y() >= height) {
            throw new IllegalStateException("Goal " + goal + " is off the " + width + "x" + height + " grid");
        }
        Set<Tile> seen = new HashSet<>();
        for (Piece piece : pieces) {
            for (Tile tile : piece.occupies()) {
                if (tile.x() >= width || tile.y() >= height) {
                    throw new IllegalStateException(piece + " leaves the grid at " + tile);
                }
                if (!seen.add(tile)) {
                    throw new IllegalStateException(piece + " overlaps another piece at " + tile);
                }
            }
        }
        return new Board(width, height, goal, pieces);
    }
}
