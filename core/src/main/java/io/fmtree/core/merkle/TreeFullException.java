package io.fmtree.core.merkle;

/**
 * Raised when an insert would take the tree past its leaf capacity.
 * The tree is left unmodified.
 */
public final class TreeFullException extends IllegalStateException {

    private final int capacity;

    public TreeFullException(int capacity) {
        super("Tree is full");
        this.capacity = capacity;
    }

    /** Leaf capacity of the tree that rejected the insert. */
    public int capacity() { return capacity; }
}
