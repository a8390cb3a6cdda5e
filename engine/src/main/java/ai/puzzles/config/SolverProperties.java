package ai.puzzles.config;

import ai.puzzles.game.PuzzleCatalog;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the puzzle runner and solver.
 *
 * Usage:
 * {@code java -jar engine.jar --solver.puzzle=sample --solver.verbose=true}
 * or {@code -Dsolver.max-plies=40}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "solver")
public class SolverProperties {
  /** Catalog name of the puzzle to solve. */
  private String puzzle = PuzzleCatalog.DEFAULT_PUZZLE;
  /** When true, the runner lists every move of the solution. */
  private boolean verbose = false;
  /** Maximum search depth in plies; zero or less searches until the space is exhausted. */
  private int maxPlies = 0;

  /**
   * Returns the catalog name of the puzzle to solve.
   * @return the puzzle name
   */
  public String getPuzzle() {
    return puzzle;
  }

  /**
   * Sets the catalog name of the puzzle to solve.
   * @param puzzle the puzzle name
   */
  public void setPuzzle(String puzzle) {
    this.puzzle = puzzle;
  }

  /**
   * Returns whether the solution's moves are printed.
   * @return true if verbose output is enabled
   */
  public boolean isVerbose() {
    return verbose;
  }

  /**
   * Enables or disables the move listing.
   * @param verbose true to print every move
   */
  public void setVerbose(boolean verbose) {
    this.verbose = verbose;
  }

  /**
   * Returns the search depth cap; zero or less means no cap.
   * @return the maximum number of plies
   */
  public int getMaxPlies() {
    return maxPlies;
  }

  /**
   * Sets the search depth cap.
   * @param maxPlies the maximum number of plies, or zero for no cap
   */
  public void setMaxPlies(int maxPlies) {
    this.maxPlies = maxPlies;
  }
}
