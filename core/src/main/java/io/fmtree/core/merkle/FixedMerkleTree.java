package io.fmtree.core.merkle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-depth binary Merkle tree with:
 *  - an injected hash function,
 *  - one growable list per layer,
 *  - precomputed zero-subtree values for padding.
 * <p>
 * Tree layout:
 *  - layers[0] holds the leaves, dense, in index order
 *  - layers[k] has ceil(layers[k-1].size() / 2) nodes
 *  - layers[k][i] = hash(layers[k-1][2i], layers[k-1][2i+1] or zeros[k-1])
 *  - root = layers[levels][0], or zeros[levels] for an empty tree
 * <p>
 * Capacity is {@code 2 << levels}. Leaves past {@code 2^levels} land under
 * layers[levels][1] and therefore do not contribute to the root.
 * <p>
 * Single-mutator only: there is no internal synchronization.
 */
public final class FixedMerkleTree<T> implements MerkleTree<T> {
    private static final Logger log = Logger.getLogger(FixedMerkleTree.class.getName());

    /** Largest depth whose capacity still fits in an int. */
    public static final int MAX_LEVELS = 29;

    private final int levels;
    private final int capacity;               // 2 << levels
    private final T zeroElement;
    private final HashFunction<T> hashFunction;
    private final List<T> zeros;              // zeros[k] = root of an empty subtree of height k
    private final List<List<T>> layers;       // layers[0] = leaves, layers[levels] = root layer

    /**
     * Build a tree over a copy of {@code elements}.
     *
     * @param levels       depth of the tree, 0..{@value #MAX_LEVELS}
     * @param elements     initial leaves, index order preserved
     * @param hashFunction combiner for two children
     * @param zeroElement  value for leaf positions with no element
     * @throws TreeFullException if there are more elements than the tree can hold
     */
    public FixedMerkleTree(int levels, List<? extends T> elements, HashFunction<T> hashFunction, T zeroElement) {
        if (levels < 0 || levels > MAX_LEVELS) {
            throw new IllegalArgumentException("levels must be between 0 and " + MAX_LEVELS + ": " + levels);
        }
        Objects.requireNonNull(elements, "elements");
        this.levels = levels;
        this.capacity = 2 << levels;
        this.hashFunction = Objects.requireNonNull(hashFunction, "hashFunction");
        this.zeroElement = Objects.requireNonNull(zeroElement, "zeroElement");

        if (elements.size() > capacity) {
            throw new TreeFullException(capacity);
        }

        // 1) zero-subtree values, bottom up
        var z = new ArrayList<T>(levels + 1);
        z.add(zeroElement);
        for (int i = 1; i <= levels; i++) {
            z.add(hash(z.get(i - 1), z.get(i - 1)));
        }
        this.zeros = Collections.unmodifiableList(z);

        // 2) leaves are copied so the caller's list is never aliased
        this.layers = new ArrayList<>(levels + 1);
        var leaves = new ArrayList<T>(elements.size());
        for (T e : elements) {
            leaves.add(Objects.requireNonNull(e, "element"));
        }
        layers.add(leaves);
        for (int level = 1; level <= levels; level++) {
            layers.add(new ArrayList<>());
        }

        // 3) internal layers
        rebuild();
        log.log(Level.FINE, "Built tree levels={0} capacity={1} leaves={2}",
                new Object[] { levels, capacity, leaves.size() });
    }

    @Override public T root() {
        List<T> top = layers.get(levels);
        return top.isEmpty() ? zeros.get(levels) : top.get(0);
    }

    @Override public void insert(T element) {
        if (size() >= capacity) {
            throw new TreeFullException(capacity);
        }
        update(size(), element);
    }

    @Override public void bulkInsert(List<? extends T> elements) {
        Objects.requireNonNull(elements, "elements");
        if (elements.size() > capacity - size()) {
            throw new TreeFullException(capacity);
        }
        if (elements.isEmpty()) return;

        // List.copyOf rejects null elements before anything is appended.
        List<T> batch = List.copyOf(elements);
        layers.get(0).addAll(batch);
        rebuild();
        log.log(Level.FINE, "Bulk inserted {0} leaves, tree now holds {1}",
                new Object[] { batch.size(), size() });
    }

    @Override public void update(int index, T element) {
        if (index < 0 || index > size() || index >= capacity) {
            throw new LeafIndexOutOfBoundsException("Insert index out of bounds", index);
        }
        Objects.requireNonNull(element, "element");

        put(layers.get(0), index, element);
        for (int level = 1; level <= levels; level++) {
            index >>= 1;
            put(layers.get(level), index, parentOf(level, index));
        }
        if (log.isLoggable(Level.FINER)) {
            log.finer("Updated leaf path, root=" + root());
        }
    }

    @Override public Proof<T> proof(int index) {
        if (index < 0 || index >= size()) {
            throw new LeafIndexOutOfBoundsException("Index out of bounds", index);
        }
        var pathElements = new ArrayList<T>(levels);
        var pathIndices = new ArrayList<Integer>(levels);
        for (int level = 0; level < levels; level++) {
            pathIndices.add(index % 2);
            pathElements.add(nodeOrZero(level, index ^ 1));
            index >>= 1;
        }
        return new Proof<>(pathElements, pathIndices);
    }

    @Override public Proof<T> proofOf(T element) {
        int index = indexOf(element);
        if (index < 0) {
            throw new NoSuchElementException("Element not found: " + element);
        }
        return proof(index);
    }

    @Override public int indexOf(T element) {
        return indexOf(element, Objects::equals);
    }

    @Override public int indexOf(T element, BiPredicate<? super T, ? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        List<T> leaves = layers.get(0);
        for (int i = 0; i < leaves.size(); i++) {
            if (comparator.test(element, leaves.get(i))) return i;
        }
        return -1;
    }

    @Override public int levels() { return levels; }

    @Override public int capacity() { return capacity; }

    @Override public int size() { return layers.get(0).size(); }

    @Override public T zeroElement() { return zeroElement; }

    @Override public List<T> elements() { return List.copyOf(layers.get(0)); }

    @Override public List<T> zeros() { return zeros; }

    @Override public List<List<T>> layers() {
        var out = new ArrayList<List<T>>(layers.size());
        for (var layer : layers) {
            out.add(List.copyOf(layer));
        }
        return Collections.unmodifiableList(out);
    }

    @Override public String toString() {
        return "FixedMerkleTree{levels=" + levels + ", size=" + size() + ", root=" + root() + "}";
    }

    // ---------------- helpers ----------------

    /** Recompute every internal layer from the leaves. O(size). */
    private void rebuild() {
        for (int level = 1; level <= levels; level++) {
            List<T> below = layers.get(level - 1);
            int width = (below.size() + 1) >>> 1; // ceil(size / 2)
            var layer = new ArrayList<T>(width);
            for (int i = 0; i < width; i++) {
                layer.add(hashChildren(below, i, level - 1));
            }
            layers.set(level, layer);
        }
    }

    /** Parent value at (level, index) from the two children one layer below. */
    private T parentOf(int level, int index) {
        return hashChildren(layers.get(level - 1), index, level - 1);
    }

    private T hashChildren(List<T> below, int parentIndex, int belowLevel) {
        int left = parentIndex << 1;
        T right = left + 1 < below.size() ? below.get(left + 1) : zeros.get(belowLevel);
        return hash(below.get(left), right);
    }

    private T nodeOrZero(int level, int index) {
        List<T> layer = layers.get(level);
        return index < layer.size() ? layer.get(index) : zeros.get(level);
    }

    private T hash(T left, T right) {
        return Objects.requireNonNull(hashFunction.hash(left, right), "hash function returned null");
    }

    /** Set {@code layer[index]}, appending when index is one past the end. */
    private static <T> void put(List<T> layer, int index, T value) {
        if (index == layer.size()) {
            layer.add(value);
        } else {
            layer.set(index, value);
        }
    }
}
