package ai.puzzles.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.game.Board;
import ai.puzzles.game.Direction;
import ai.puzzles.game.Move;
import ai.puzzles.game.Tile;
import ai.puzzles.unit.helpers.BoardBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Move generation on hand-built boards with exactly known move lists.
 */
class LegalMovesTest {

    @Test
    void emitsEveryStepLengthUpToTheEdge() {
        Board board = BoardBuilder.newBoard(3, 1)
                .goal(2, 0)
                .marked(0, 0, 1, Direction.HORIZONTAL)
                .build();

        assertEquals(List.of(Move.right(new Tile(0, 0), 1), Move.right(new Tile(0, 0), 2)), board.allMoves());
    }

    @Test
    void horizontalPieceProbesRightThenLeft() {
        Board board = BoardBuilder.newBoard(5, 1)
                .goal(4, 0)
                .marked(1, 0, 2, Direction.HORIZONTAL)
                .build();
        Tile origin = new Tile(1, 0);

        assertEquals(List.of(Move.right(origin, 1), Move.right(origin, 2), Move.left(origin, 1)),
                board.allMoves());
    }

    @Test
    void probingStopsAtFirstOccupiedTile() {
        Board board = BoardBuilder.newBoard(5, 1)
                .goal(4, 0)
                .marked(0, 0, 1, Direction.HORIZONTAL)
                .horizontal(3, 0, 1)
                .build();
        Tile marked = new Tile(0, 0);
        Tile blocker = new Tile(3, 0);

        assertEquals(List.of(
                Move.right(marked, 1),
                Move.right(marked, 2),
                Move.right(blocker, 1),
                Move.left(blocker, 1),
                Move.left(blocker, 2)), board.allMoves());
    }

    @Test
    void verticalPieceProbesUpThenDown() {
        Board board = BoardBuilder.newBoard(1, 4)
                .goal(0, 0)
                .marked(0, 1, 2, Direction.VERTICAL)
                .build();
        Tile origin = new Tile(0, 1);

        assertEquals(List.of(Move.up(origin, 1), Move.down(origin, 1)), board.allMoves());
    }

    @Test
    void piecesOnlySlideAlongTheirOwnAxis() {
        Board board = BoardBuilder.newBoard(3, 3)
                .goal(2, 1)
                .marked(1, 1, 1, Direction.HORIZONTAL)
                .build();
        Tile origin = new Tile(1, 1);

        assertEquals(List.of(Move.right(origin, 1), Move.left(origin, 1)), board.allMoves());
    }

    @Test
    void pieceFillingItsRowHasNoMoves() {
        Board board = BoardBuilder.newBoard(2, 1)
                .goal(1, 0)
                .marked(0, 0, 2, Direction.HORIZONTAL)
                .build();

        assertTrue(board.allMoves().isEmpty());
    }

    @Test
    void boxedInPieceHasNoMoves() {
        Board board = BoardBuilder.newBoard(3, 3)
                .goal(2, 2)
                .vertical(1, 0, 1)
                .marked(1, 1, 1, Direction.VERTICAL)
                .vertical(1, 2, 1)
                .horizontal(0, 0, 1)
                .build();

        assertTrue(board.allMoves().stream().noneMatch(move -> move.origin().equals(new Tile(1, 1))));
    }
}
