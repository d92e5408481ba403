package io.fmtree.core.merkle;

import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Abstraction for a fixed-depth binary Merkle tree over an append-only
 * (or update-in-place) sequence of leaves.
 * <p>
 * At a high level:
 *  - The tree has {@code levels + 1} layers; layer 0 holds the leaves,
 *    layer {@code levels} holds the root.
 *  - Each internal node is {@code hash(leftChild, rightChild)}; a missing
 *    right child is replaced by the zero-subtree value of its level.
 *  - The hash function is injected, the tree never hashes anything itself.
 * <p>
 * Implementations are not thread safe. Callers sharing a tree must
 * serialize access themselves.
 *
 * @param <T> leaf and node value type
 */
public interface MerkleTree<T> {

    /**
     * Root value of the tree.
     * An empty tree has the zero-subtree value of the top level as its root.
     * Time: O(1)
     */
    T root();

    /**
     * Append one leaf at the next free index and recompute its path.
     *
     * @throws TreeFullException if the tree already holds {@link #capacity()} leaves
     */
    void insert(T element);

    /**
     * Append a batch of leaves and rebuild every internal layer.
     * Nothing is appended when the batch does not fit.
     *
     * @throws TreeFullException if {@code size() + elements.size() > capacity()}
     */
    void bulkInsert(List<? extends T> elements);

    /**
     * Overwrite the leaf at {@code index}, or append when {@code index == size()}.
     * Only the path from that leaf upwards is recomputed.
     * Time: O(levels)
     *
     * @throws LeafIndexOutOfBoundsException if {@code index} is negative,
     *         greater than {@code size()} or not below {@code capacity()}
     */
    void update(int index, T element);

    /**
     * Authentication path for the leaf at {@code index}.
     *
     * @throws LeafIndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
     */
    Proof<T> proof(int index);

    /**
     * Authentication path for the first leaf equal to {@code element}.
     *
     * @throws java.util.NoSuchElementException if the element is not a leaf of this tree
     */
    Proof<T> proofOf(T element);

    /** First index of {@code element} among the leaves, or -1. Uses {@link Object#equals}. */
    int indexOf(T element);

    /** First index of a leaf that {@code comparator} matches against {@code element}, or -1. */
    int indexOf(T element, BiPredicate<? super T, ? super T> comparator);

    /** Depth of the tree, fixed at construction. */
    int levels();

    /** Maximum number of leaves: {@code 2 << levels}. */
    int capacity();

    /** Number of leaves currently stored. */
    int size();

    /** Value used for leaf positions with no element. */
    T zeroElement();

    /** Leaves in index order (read-only copy). */
    List<T> elements();

    /** Zero-subtree values, one per level (read-only). */
    List<T> zeros();

    /** All layers, leaves first (read-only copy). */
    List<List<T>> layers();

    /** Create an empty tree. */
    static <T> MerkleTree<T> create(int levels, HashFunction<T> hashFunction, T zeroElement) {
        return new FixedMerkleTree<>(levels, List.of(), hashFunction, zeroElement);
    }

    /** Create a tree seeded with {@code elements} (copied, index order preserved). */
    static <T> MerkleTree<T> create(int levels, List<? extends T> elements, HashFunction<T> hashFunction, T zeroElement) {
        return new FixedMerkleTree<>(levels, elements, hashFunction, zeroElement);
    }

    /**
     * Sibling path from one leaf to the top layer.
     * <p>
     * For every level, {@code pathIndices} tells which side the proven node is on
     * (0 = left child, 1 = right child) and {@code pathElements} holds the value of
     * its sibling. A verifier folds the leaf with each sibling in order, putting
     * the sibling on the right when the index is 0 and on the left when it is 1.
     */
    record Proof<T>(List<T> pathElements, List<Integer> pathIndices) {
        public Proof {
            Objects.requireNonNull(pathElements, "pathElements");
            Objects.requireNonNull(pathIndices, "pathIndices");
            if (pathElements.size() != pathIndices.size()) {
                throw new IllegalArgumentException("pathElements and pathIndices must have the same length");
            }
            pathElements = List.copyOf(pathElements);
            pathIndices = List.copyOf(pathIndices);
        }

        /** Number of levels covered by this path. */
        public int depth() { return pathElements.size(); }
    }
}
