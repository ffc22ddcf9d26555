package com.morphirbridge.core.visitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Folds visitor contributions into one traversal value. {@code combine} is applied in
 * traversal order, starting from {@code identity}.
 */
public record Reducer<R>(R identity, BinaryOperator<R> combine) {

    public Reducer {
        Objects.requireNonNull(combine, "combine must not be null");
    }

    public static Reducer<Integer> sum() {
        return new Reducer<>(0, Integer::sum);
    }

    /**
     * Concatenates lists. The first non-empty contribution is copied into a list owned by the
     * reducer, which later contributions are appended to in place, so a traversal stays linear
     * in the number of contributions.
     */
    public static <T> Reducer<List<T>> concat() {
        return new Reducer<>(List.of(), (left, right) -> {
            if (right.isEmpty()) {
                return left;
            }
            ConcatList<T> joined = left instanceof ConcatList ? (ConcatList<T>) left : new ConcatList<>(left);
            joined.addAll(right);
            return joined;
        });
    }

    /**
     * Merges maps; on key collision the later value wins. Appends in place like {@link #concat()}.
     */
    public static <K, V> Reducer<Map<K, V>> merge() {
        return new Reducer<>(Map.of(), (left, right) -> {
            if (right.isEmpty()) {
                return left;
            }
            MergeMap<K, V> merged = left instanceof MergeMap ? (MergeMap<K, V>) left : new MergeMap<>(left);
            merged.putAll(right);
            return merged;
        });
    }

    private static final class ConcatList<T> extends ArrayList<T> {

        ConcatList(List<T> initial) {
            super(initial);
        }
    }

    private static final class MergeMap<K, V> extends LinkedHashMap<K, V> {

        MergeMap(Map<K, V> initial) {
            super(initial);
        }
    }

    /**
     * For rewriting traversals that produce no value.
     */
    public static <R> Reducer<R> none() {
        return new Reducer<>(null, (left, right) -> left);
    }
}
