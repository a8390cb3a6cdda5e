package ai.puzzles.game;

import java.util.Locale;
import java.util.Objects;

/**
 * A single slide of one piece.
 *
 * <p>A move names the piece by its current location ({@link #origin()}) and carries a
 * positive step count. {@link Type#LEFT}/{@link Type#RIGHT} slide along the x axis,
 * {@link Type#UP}/{@link Type#DOWN} along the y axis. The type itself does not know the
 * axis of the piece it is applied to; only {@link Board#allMoves()} guarantees that a move
 * fits its piece.
 *
 * <p>Every slide counts as one ply, whatever its step count.
 */
public final class Move {

    /**
     * Slide direction.
     */
    public enum Type {
        LEFT(-1, 0),
        RIGHT(1, 0),
        UP(0, -1),
        DOWN(0, 1);

        private final int dx;
        private final int dy;

        Type(int dx, int dy) {
            this.dx = dx;
            this.dy = dy;
        }

        /**
         * Returns the slide type pointing the other way.
         */
        public Type opposite() {
            return switch (this) {
                case LEFT -> RIGHT;
                case RIGHT -> LEFT;
                case UP -> DOWN;
                case DOWN -> UP;
            };
        }

        /**
         * Lower-case name used in rendered moves, e.g. {@code right}.
         */
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Type type;
    private final Tile origin;
    private final int steps;

    private Move(Type type, Tile origin, int steps) {
        this.type = Objects.requireNonNull(type, "type");
        this.origin = Objects.requireNonNull(origin, "origin");
        if (steps < 1) {
            throw new IllegalArgumentException("Move must cover at least one step: " + steps);
        }
        this.steps = steps;
    }

    public static Move of(Type type, Tile origin, int steps) {
        return new Move(type, origin, steps);
    }

    public static Move left(Tile origin, int steps) {
        return new Move(Type.LEFT, origin, steps);
    }

    public static Move right(Tile origin, int steps) {
        return new Move(Type.RIGHT, origin, steps);
    }

    public static Move up(Tile origin, int steps) {
        return new Move(Type.UP, origin, steps);
    }

    public static Move down(Tile origin, int steps) {
        return new Move(Type.DOWN, origin, steps);
    }

    public Type type() {
        return type;
    }

    /**
     * Location of the piece being moved, before the move.
     */
    public Tile origin() {
        return origin;
    }

    public int steps() {
        return steps;
    }

    /**
     * Location of the moved piece after the move.
     *
     * @throws IllegalArgumentException if the slide would leave the non-negative quadrant
     */
    public Tile destination() {
        return origin.offset(type.dx * steps, type.dy * steps);
    }

    /**
     * Returns the move that takes the piece back: same step count, opposite direction,
     * starting from {@link #destination()}.
     */
    public Move inverse() {
        return new Move(type.opposite(), destination(), steps);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Move)) {
            return false;
        }
        Move other = (Move) o;
        return type == other.type && steps == other.steps && origin.equals(other.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, origin, steps);
    }

    /**
     * Renders the move for console output, e.g. {@code Move (0,2) right by 3 steps}.
     */
    @Override
    public String toString() {
        return "Move " + origin + " " + type.label() + " by " + steps + " steps";
    }
}
