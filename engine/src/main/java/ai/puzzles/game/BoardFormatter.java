package ai.puzzles.game;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link Board} as a character grid for console and debug output.
 * <p>
 * The marked piece is drawn as {@code *}, other pieces as {@code A}, {@code B}, ... in
 * definition order, an uncovered goal tile as {@code G} and free tiles as {@code .}.
 * Rows are framed by a border line:
 * <pre>
 * -----------
 * | * * . G |
 * -----------
 * </pre>
 */
public class BoardFormatter {
    private static final char MARKED = '*';
    private static final char GOAL = 'G';
    private static final char EMPTY = '.';
    private static final String LABELS = "ABCDEFHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private final Board board;

    /**
     * @param board the board to render; must not be null
     */
    public BoardFormatter(Board board) {
        this.board = board;
    }

    /**
     * Renders the board as a multi-line string.
     *
     * @return the framed grid, one line per row, ending with a newline
     */
    public String format() {
        Map<Tile, Character> cells = labelCells();
        StringBuilder sb = new StringBuilder();
        String border = "-".repeat(board.getWidth() * 2 + 3);
        sb.append(border).append('\n');
        for (int y = 0; y < board.getHeight(); y++) {
            sb.append('|');
            for (int x = 0; x < board.getWidth(); x++) {
                Tile tile = new Tile(x, y);
                char cell = cells.getOrDefault(tile, tile.equals(board.getGoal()) ? GOAL : EMPTY);
                sb.append(' ').append(cell);
            }
            sb.append(" |\n");
        }
        sb.append(border).append('\n');
        return sb.toString();
    }

    private Map<Tile, Character> labelCells() {
        Map<Tile, Character> cells = new HashMap<>();
        List<Piece> pieces = board.getPieces();
        int next = 0;
        for (Piece piece : pieces) {
            char label;
            if (piece.isMarked()) {
                label = MARKED;
            } else {
                label = LABELS.charAt(next % LABELS.length());
                next++;
            }
            for (Tile tile : piece.occupies()) {
                cells.put(tile, label);
            }
        }
        return cells;
    }
}
