package ai.puzzles.solver;

import ai.puzzles.config.SolverProperties;
import ai.puzzles.game.Board;
import ai.puzzles.game.Successor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Level-synchronized breadth-first solver.
 *
 * <p>Each ply, the frontier (boards produced by the previous level's expansion) is filtered
 * against the transposition table; survivors are recorded with the move that produced them.
 * Survivors are then checked in generation order: the first won board ends the search,
 * otherwise its one-ply successors join the next frontier. Because every board at depth k is
 * recorded and checked before any board at depth k+1, the ply count of the returned solution
 * is minimal. A slide of any length counts as one ply.
 *
 * <p>Termination:
 * <ul>
 *     <li>A start board that is already won yields a zero-ply solution.</li>
 *     <li>When a level produces no successors, every reachable board has been seen and the
 *     search returns empty.</li>
 *     <li>With a positive ply cap, the search returns empty once the cap is reached.</li>
 * </ul>
 *
 * <p>Memory grows with the number of distinct boards discovered; the whole table is kept
 * until the path has been reconstructed.
 */
@Component
public class BreadthFirstSolver implements Solver {

    private static final Logger log = LoggerFactory.getLogger(BreadthFirstSolver.class);

    private final int maxPlies;

    /**
     * Creates a solver without a ply cap.
     */
    public BreadthFirstSolver() {
        this(0);
    }

    /**
     * @param maxPlies search depth cap; zero or less searches until the space is exhausted
     */
    public BreadthFirstSolver(int maxPlies) {
        this.maxPlies = maxPlies;
    }

    @Autowired
    public BreadthFirstSolver(SolverProperties properties) {
        this(properties.getMaxPlies());
    }

    @Override
    public Optional<Solution> solve(Board start) {
        TranspositionTable table = new TranspositionTable();
        table.recordRoot(start);
        if (start.isWon()) {
            if (log.isDebugEnabled()) {
                log.debug("Start board is already won");
            }
            return Optional.of(new Solution(start, 0, List.of(), table.size()));
        }

        List<Successor> frontier = start.futureBoards();
        int plies = 0;
        while (true) {
            // Drop boards seen at this or a shallower depth; record the rest.
            List<Board> admitted = new ArrayList<>();
            for (Successor successor : frontier) {
                if (table.record(successor.board(), successor.move())) {
                    admitted.add(successor.board());
                }
            }
            plies++;

            List<Successor> next = new ArrayList<>();
            for (Board board : admitted) {
                if (board.isWon()) {
                    Solution solution = new Solution(board, plies, table.pathTo(board), table.size());
                    if (log.isDebugEnabled()) {
                        log.debug("Solved in {} plies after discovering {} boards", plies, table.size());
                    }
                    return Optional.of(solution);
                }
                next.addAll(board.futureBoards());
            }

            if (log.isDebugEnabled()) {
                log.debug("Ply {}: {} candidates, {} new boards, {} successors queued, table size {}",
                        plies, frontier.size(), admitted.size(), next.size(), table.size());
            }

            if (next.isEmpty()) {
                log.info("Search space exhausted after {} plies and {} boards; puzzle has no solution",
                        plies, table.size());
                return Optional.empty();
            }
            if (maxPlies > 0 && plies >= maxPlies) {
                log.warn("Ply limit reached ({}) with {} boards discovered; giving up", maxPlies, table.size());
                return Optional.empty();
            }
            frontier = next;
        }
    }
}
