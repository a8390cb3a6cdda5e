package ai.puzzles.game;

import static ai.puzzles.game.Direction.HORIZONTAL;
import static ai.puzzles.game.Direction.VERTICAL;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Hardcoded puzzle definitions, looked up by name.
 * <p>
 * <ul>
 *   <li><b>sample</b> - 6x6 rush-hour layout with twelve pieces; the marked car sits on row 2
 *       and must reach the right edge at (5,2).</li>
 *   <li><b>corridor</b> - 3x1 row, one slide of two tiles.</li>
 *   <li><b>solved</b> - 2x1 row already covered by the marked piece.</li>
 *   <li><b>dead-end</b> - 4x1 row where a blocker can never leave the marked piece's way.</li>
 * </ul>
 */
public final class PuzzleCatalog {
    public static final String DEFAULT_PUZZLE = "sample";

    private static final Map<String, Board> PUZZLES = createPuzzles();

    private PuzzleCatalog() {
    }

    /**
     * Returns the initial board of the named puzzle.
     *
     * @param name catalog name, e.g. {@code sample}
     * @return the initial board
     * @throws IllegalArgumentException if no puzzle has that name
     */
    public static Board named(String name) {
        Board board = name == null ? null : PUZZLES.get(name.trim().toLowerCase(Locale.ROOT));
        if (board == null) {
            throw new IllegalArgumentException("Unknown puzzle '" + name + "'; known puzzles: " + names());
        }
        return board;
    }

    /**
     * Returns the catalog names in definition order.
     */
    public static Set<String> names() {
        return Collections.unmodifiableSet(PUZZLES.keySet());
    }

    private static Map<String, Board> createPuzzles() {
        Map<String, Board> puzzles = new LinkedHashMap<>();
        puzzles.put(DEFAULT_PUZZLE, new Board(6, 6, new Tile(5, 2), List.of(
                Piece.marked(new Tile(0, 2), 2, HORIZONTAL),
                Piece.of(new Tile(0, 3), 2, HORIZONTAL),
                Piece.of(new Tile(0, 4), 2, VERTICAL),
                Piece.of(new Tile(1, 4), 2, VERTICAL),
                Piece.of(new Tile(2, 0), 2, VERTICAL),
                Piece.of(new Tile(2, 2), 2, VERTICAL),
                Piece.of(new Tile(2, 4), 2, HORIZONTAL),
                Piece.of(new Tile(2, 5), 2, HORIZONTAL),
                Piece.of(new Tile(3, 0), 3, HORIZONTAL),
                Piece.of(new Tile(3, 3), 2, HORIZONTAL),
                Piece.of(new Tile(3, 1), 2, VERTICAL),
                Piece.of(new Tile(5, 2), 3, VERTICAL))));
        puzzles.put("corridor", new Board(3, 1, new Tile(2, 0), List.of(
                Piece.marked(new Tile(0, 0), 1, HORIZONTAL))));
        puzzles.put("solved", new Board(2, 1, new Tile(1, 0), List.of(
                Piece.marked(new Tile(0, 0), 2, HORIZONTAL))));
        puzzles.put("dead-end", new Board(4, 1, new Tile(3, 0), List.of(
                Piece.marked(new Tile(0, 0), 1, HORIZONTAL),
                Piece.of(new Tile(1, 0), 1, HORIZONTAL))));
        return Collections.unmodifiableMap(puzzles);
    }
}
