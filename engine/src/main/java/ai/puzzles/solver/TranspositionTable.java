package ai.puzzles.solver;

import ai.puzzles.game.Board;
import ai.puzzles.game.Move;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Boards discovered during one search, each mapped to the move that first produced it.
 * <p>
 * The start board maps to no move. Entries are only ever added, never replaced or removed,
 * so the first (shallowest, in breadth-first order) path to a board is the one kept. Not
 * thread-safe; a table belongs to a single search.
 */
final class TranspositionTable {
    /** The start board is stored with a {@code null} move. */
    private final Map<Board, Move> entries = new HashMap<>();

    /**
     * Records the start board of the search.
     */
    void recordRoot(Board root) {
        entries.put(root, null);
    }

    /**
     * Records {@code board} as reached by {@code move} unless it is already known.
     *
     * @return {@code true} if the board was new and has been recorded
     */
    boolean record(Board board, Move move) {
        if (entries.containsKey(board)) {
            return false;
        }
        entries.put(board, move);
        return true;
    }

    boolean contains(Board board) {
        return entries.containsKey(board);
    }

    /**
     * Returns the move that produced {@code board}, or empty for the start board.
     *
     * @throws IllegalArgumentException if the board was never recorded
     */
    Optional<Move> predecessorMove(Board board) {
        if (!entries.containsKey(board)) {
            throw new IllegalArgumentException("Board was never discovered:\n" + board);
        }
        return Optional.ofNullable(entries.get(board));
    }

    int size() {
        return entries.size();
    }

    /**
     * Walks back from {@code board} to the start board by undoing recorded moves.
     *
     * @return the moves from the start board to {@code board}, in play order
     */
    List<Move> pathTo(Board board) {
        List<Move> history = new ArrayList<>();
        Board current = board;
        Optional<Move> previous = predecessorMove(current);
        while (previous.isPresent()) {
            Move move = previous.get();
            history.add(move);
            current = current.undo(move);
            previous = predecessorMove(current);
        }
        Collections.reverse(history);
        return history;
    }
}
