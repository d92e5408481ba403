package io.fmtree.core.merkle;

/**
 * Combiner that folds two child values into their parent value.
 * <p>
 * Arguments are passed in positional order (left, right), so a
 * non-commutative function such as a digest over the concatenation is
 * the expected use. Tree invariants only hold for pure functions.
 */
@FunctionalInterface
public interface HashFunction<T> {

    T hash(T left, T right);
}
