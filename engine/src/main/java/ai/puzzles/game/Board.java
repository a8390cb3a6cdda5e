package ai.puzzles.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a sliding-block puzzle.
 * <p>
 * A board holds its dimensions, the goal tile and the ordered list of pieces. The set of
 * occupied tiles and the win flag are derived from the pieces once, at construction.
 * <p>
 * <strong>Identity:</strong> two boards are equal when their dimensions, goal and piece
 * lists (in order) are equal. {@link #play(Move)} rebuilds the piece list in its original
 * order, so two move sequences that end in the same physical configuration give equal boards
 * with equal hash codes. This is what lets the solver use boards as transposition table keys.
 * <p>
 * <strong>Preconditions:</strong> pieces do not overlap and lie inside the grid. Neither is
 * checked.
 */
public final class Board {
    private final int width;
    private final int height;
    private final Tile goal;
    /** Pieces in definition order; the order is part of the board's identity. */
    private final List<Piece> pieces;
    /** Union of all piece footprints. */
    private final Set<Tile> occupiedTiles;
    /** True when a marked piece covers the goal tile. */
    private final boolean won;
    /** Cached, boards are hashed on every table lookup. */
    private final int hash;

    /**
     * Creates a board and derives its occupancy and win flag.
     *
     * @param width  number of columns, at least one
     * @param height number of rows, at least one
     * @param goal   tile the marked piece has to cover
     * @param pieces pieces in a fixed order
     * @throws IllegalArgumentException if a dimension is less than one
     */
    public Board(int width, int height, Tile goal, List<Piece> pieces) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Board dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.goal = Objects.requireNonNull(goal, "goal");
        this.pieces = List.copyOf(pieces);
        this.occupiedTiles = occupiedTiles(this.pieces);
        this.won = this.pieces.stream()
                .anyMatch(piece -> piece.isMarked() && piece.occupies().contains(goal));
        this.hash = Objects.hash(width, height, goal, this.pieces);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Tile getGoal() {
        return goal;
    }

    public List<Piece> getPieces() {
        return pieces;
    }

    public Set<Tile> getOccupiedTiles() {
        return occupiedTiles;
    }

    /**
     * Returns {@code true} if any tile of a marked piece is the goal tile.
     */
    public boolean isWon() {
        return won;
    }

    /**
     * Lists every legal slide on this board.
     * <p>
     * Pieces are visited in order. A horizontal piece yields its right slides and then its
     * left slides; a vertical piece yields its up slides and then its down slides. For each
     * direction the probe walks away from the piece one tile at a time and stops at the first
     * tile that is off the grid or occupied, emitting one move per reachable distance
     * (1, 2, ... up to the longest free run).
     *
     * @return the legal moves, in generation order
     */
    public List<Move> allMoves() {
        List<Move> moves = new ArrayList<>();
        for (Piece piece : pieces) {
            Tile location = piece.getLocation();
            int x = location.x();
            int y = location.y();
            if (piece.getDirection() == Direction.HORIZONTAL) {
                int start = x;
                int end = piece.endTile().x();
                for (int i = 1; end + i < width; i++) {
                    if (!emptyTile(new Tile(end + i, y))) {
                        break;
                    }
                    moves.add(Move.right(location, i));
                }
                for (int i = 1; i <= start; i++) {
                    if (!emptyTile(new Tile(start - i, y))) {
                        break;
                    }
                    moves.add(Move.left(location, i));
                }
            } else {
                int start = y;
                int end = piece.endTile().y();
                for (int i = 1; i <= start; i++) {
                    if (!emptyTile(new Tile(x, start - i))) {
                        break;
                    }
                    moves.add(Move.up(location, i));
                }
                for (int i = 1; end + i < height; i++) {
                    if (!emptyTile(new Tile(x, end + i))) {
                        break;
                    }
                    moves.add(Move.down(location, i));
                }
            }
        }
        return moves;
    }

    /**
     * Returns every board one ply away, paired with the move that produces it, in the order
     * of {@link #allMoves()}.
     */
    public List<Successor> futureBoards() {
        List<Move> moves = allMoves();
        List<Successor> successors = new ArrayList<>(moves.size());
        for (Move move : moves) {
            successors.add(new Successor(play(move), move));
        }
        return successors;
    }

    /**
     * Applies a move and returns the resulting board.
     * <p>
     * The piece whose location equals {@link Move#origin()} is relocated to
     * {@link Move#destination()}; every other piece keeps its place in the list. The move is
     * not validated: callers pass moves obtained from {@link #allMoves()}. A move whose
     * origin matches no piece yields an equal board.
     *
     * @param move the move to apply
     * @return a new board
     */
    public Board play(Move move) {
        Tile origin = move.origin();
        List<Piece> moved = new ArrayList<>(pieces.size());
        for (Piece piece : pieces) {
            moved.add(piece.getLocation().equals(origin) ? piece.movedTo(move.destination()) : piece);
        }
        return new Board(width, height, goal, moved);
    }

    /**
     * Reverses a move previously applied to reach this board.
     * <p>
     * For a move {@code m} generated on board {@code b}, {@code b.play(m).undo(m)} equals
     * {@code b}.
     *
     * @param move the move that led to this board
     * @return the board before the move
     */
    public Board undo(Move move) {
        return play(move.inverse());
    }

    /**
     * Returns {@code true} if the tile is on the grid and not covered by any piece.
     */
    public boolean emptyTile(Tile tile) {
        return tileExists(tile) && !occupiedTiles.contains(tile);
    }

    /**
     * Returns {@code true} if the tile lies within {@code [0, width) x [0, height)}.
     */
    public boolean tileExists(Tile tile) {
        return tile.x() < width && tile.y() < height;
    }

    private static Set<Tile> occupiedTiles(List<Piece> pieces) {
        Set<Tile> tiles = new HashSet<>();
        for (Piece piece : pieces) {
            tiles.addAll(piece.occupies());
        }
        return Collections.unmodifiableSet(tiles);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        return hash == other.hash
                && width == other.width
                && height == other.height
                && won == other.won
                && goal.equals(other.goal)
                && pieces.equals(other.pieces)
                && occupiedTiles.equals(other.occupiedTiles);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new BoardFormatter(this).format();
    }
}
