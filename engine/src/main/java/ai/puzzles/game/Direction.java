package ai.puzzles.game;

/**
 * Axis along which a {@link Piece} lies and slides.
 */
public enum Direction {
    /** Piece extends to the right of its location and slides left/right. */
    HORIZONTAL,
    /** Piece extends below its location and slides up/down. */
    VERTICAL
}
