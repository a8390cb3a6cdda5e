package ai.puzzles.solver;

import ai.puzzles.game.Board;
import ai.puzzles.game.Move;
import java.util.List;
import java.util.Objects;

/**
 * Result of a successful search.
 *
 * @param finalBoard     the won board the moves lead to
 * @param plies          number of slides in the solution
 * @param moves          the slides from the start board to {@code finalBoard}, in play order
 * @param exploredStates number of distinct boards discovered, the start board included
 */
public record Solution(Board finalBoard, int plies, List<Move> moves, int exploredStates) {
    public Solution {
        Objects.requireNonNull(finalBoard, "finalBoard");
        moves = List.copyOf(moves);
        if (plies != moves.size()) {
            throw new IllegalArgumentException("Ply count " + plies + " does not match " + moves.size() + " moves");
        }
    }
}
