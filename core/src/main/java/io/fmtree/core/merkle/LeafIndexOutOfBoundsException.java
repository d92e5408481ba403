package io.fmtree.core.merkle;

/**
 * Raised by update and proof when a leaf index falls outside the valid range.
 */
public final class LeafIndexOutOfBoundsException extends IndexOutOfBoundsException {

    private final int index;

    public LeafIndexOutOfBoundsException(String message, int index) {
        super(message + ": " + index);
        this.index = index;
    }

    /** The rejected index. */
    public int index() { return index; }
}
