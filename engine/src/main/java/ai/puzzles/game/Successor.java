package ai.puzzles.game;

import java.util.Objects;

/**
 * A board reachable in one ply together with the move that reaches it.
 */
public record Successor(Board board, Move move) {
    public Successor {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(move, "move");
    }
}
