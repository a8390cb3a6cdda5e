package ai.puzzles;

import ai.puzzles.config.SolverProperties;
import ai.puzzles.game.Board;
import ai.puzzles.game.Move;
import ai.puzzles.game.PuzzleCatalog;
import ai.puzzles.solver.Solution;
import ai.puzzles.solver.Solver;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PuzzleApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PuzzleApplication.class);
    /** Legacy switch; equivalent to {@code --solver.verbose=true}. */
    static final String VERBOSE_FLAG = "--verbose";

    private final Solver solver;
    private final SolverProperties properties;

    public PuzzleApplication(Solver solver, SolverProperties properties) {
        this.solver = solver;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PuzzleApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains(VERBOSE_FLAG)) {
            properties.setVerbose(true);
        }
        Board start;
        try {
            start = PuzzleCatalog.named(properties.getPuzzle());
        } catch (IllegalArgumentException ex) {
            log.error(ex.getMessage());
            return;
        }
        solve(start);
    }

    /**
     * Solves one board and reports the outcome.
     *
     * <p>Reports the ply count and wall-clock time, and with verbose output enabled, every
     * move of the solution in play order.
     *
     * @return summary of the run for tests and other harnesses
     */
    public PuzzleResult solve(Board start) {
        if (log.isDebugEnabled()) {
            log.debug("Solving puzzle '{}':\n{}", properties.getPuzzle(), start);
        }
        long startNanos = System.nanoTime();
        Optional<Solution> solution = solver.solve(start);
        long durationNanos = System.nanoTime() - startNanos;

        if (solution.isEmpty()) {
            log.info("No solution found");
            log.info("Total time: {} ms", TimeUnit.NANOSECONDS.toMillis(durationNanos));
            return new PuzzleResult(false, 0, List.of(), durationNanos);
        }

        Solution solved = solution.get();
        log.info("Total steps: {}", solved.plies());
        log.info("Total time: {} ms", TimeUnit.NANOSECONDS.toMillis(durationNanos));
        if (properties.isVerbose()) {
            for (Move move : solved.moves()) {
                log.info("{}", move);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Final board ({} boards discovered):\n{}", solved.exploredStates(), solved.finalBoard());
        }
        return new PuzzleResult(true, solved.plies(), solved.moves(), durationNanos);
    }

    /**
     * Lightweight summary of a single solver run.
     */
    public static final class PuzzleResult {
        private final boolean solved;
        private final int plies;
        private final List<Move> moves;
        private final long durationNanos;

        public PuzzleResult(boolean solved, int plies, List<Move> moves, long durationNanos) {
            this.solved = solved;
            this.plies = plies;
            this.moves = List.copyOf(moves);
            this.durationNanos = durationNanos;
        }

        public boolean isSolved() {
            return solved;
        }

        public int getPlies() {
            return plies;
        }

        public List<Move> getMoves() {
            return moves;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
