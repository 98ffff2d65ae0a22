package io.gamestate.core.tree;

/**
 * The two traversable shapes of a state tree: a sequence ({@link StateList})
 * or a mapping ({@link StateMap}). Everything else is a leaf.
 *
 * <p>Implementations are immutable; {@link #withChild} returns a copy that
 * shares every untouched child with the receiver.
 */
public interface Container {

    boolean isSequence();

    int size();

    /** Value addressed by {@code segment}, or null when there is none. */
    Object child(Path.Segment segment);

    /**
     * Copy of this container with {@code value} stored under {@code segment}.
     *
     * @throws IllegalArgumentException if the segment cannot address this container
     * @throws IndexOutOfBoundsException if a sequence index is past the end + 1
     */
    Container withChild(Path.Segment segment, Object value);
}
