package ai.puzzles.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.game.Direction;
import ai.puzzles.game.Piece;
import ai.puzzles.game.Tile;
import java.util.List;
import org.junit.jupiter.api.Test;

class PieceTest {

    @Test
    void horizontalPieceOccupiesTilesToTheRight() {
        Piece piece = Piece.of(new Tile(3, 0), 3, Direction.HORIZONTAL);
        assertEquals(List.of(new Tile(3, 0), new Tile(4, 0), new Tile(5, 0)), piece.occupies());
        assertEquals(new Tile(5, 0), piece.endTile());
    }

    @Test
    void verticalPieceOccupiesTilesBelow() {
        Piece piece = Piece.of(new Tile(5, 2), 3, Direction.VERTICAL);
        assertEquals(List.of(new Tile(5, 2), new Tile(5, 3), new Tile(5, 4)), piece.occupies());
        assertEquals(new Tile(5, 4), piece.endTile());
    }

    @Test
    void singleTilePieceOccupiesItsLocation() {
        Piece piece = Piece.marked(new Tile(1, 1), 1, Direction.VERTICAL);
        assertEquals(List.of(new Tile(1, 1)), piece.occupies());
        assertEquals(piece.getLocation(), piece.endTile());
    }

    @Test
    void movedToKeepsShapeAndLeavesOriginalUntouched() {
        Piece piece = Piece.marked(new Tile(0, 2), 2, Direction.HORIZONTAL);
        Piece moved = piece.movedTo(new Tile(3, 2));

        assertEquals(new Tile(0, 2), piece.getLocation());
        assertEquals(new Tile(3, 2), moved.getLocation());
        assertEquals(2, moved.getSize());
        assertEquals(Direction.HORIZONTAL, moved.getDirection());
        assertTrue(moved.isMarked());
    }

    @Test
    void equalityCoversEveryField() {
        Piece piece = Piece.of(new Tile(1, 1), 2, Direction.HORIZONTAL);
        assertEquals(Piece.of(new Tile(1, 1), 2, Direction.HORIZONTAL), piece);
        assertEquals(Piece.of(new Tile(1, 1), 2, Direction.HORIZONTAL).hashCode(), piece.hashCode());
        assertNotEquals(Piece.marked(new Tile(1, 1), 2, Direction.HORIZONTAL), piece);
        assertNotEquals(Piece.of(new Tile(1, 1), 2, Direction.VERTICAL), piece);
        assertNotEquals(Piece.of(new Tile(1, 1), 3, Direction.HORIZONTAL), piece);
        assertNotEquals(Piece.of(new Tile(2, 1), 2, Direction.HORIZONTAL), piece);
    }

    @Test
    void rejectsEmptyPieceAndNegativeTiles() {
        assertThrows(IllegalArgumentException.class, () -> Piece.of(new Tile(0, 0), 0, Direction.HORIZONTAL));
        assertThrows(IllegalArgumentException.class, () -> new Tile(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Tile(0, 0).offset(0, -1));
    }
}
