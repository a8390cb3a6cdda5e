package ai.puzzles.solver;

import ai.puzzles.game.Board;
import java.util.Optional;

/**
 * Finds a sequence of moves that takes a board to a won configuration.
 */
public interface Solver {

    /**
     * Solves the puzzle starting at {@code start}.
     *
     * @param start the initial board
     * @return the solution, or empty if the solver gave up or proved there is none
     */
    Optional<Solution> solve(Board start);
}
