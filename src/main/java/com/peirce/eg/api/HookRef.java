package com.peirce.eg.api;

/**
 * Address of one hook: the owning predicate and the 1-based hook index.
 *
 * <p>
 * This is the attachment record stored by a ligature. Ordering is by predicate
 * id, then hook index.
 */
public record HookRef(int predicateId, int index) implements Comparable<HookRef> {

    public static HookRef of(int predicateId, int index) {
        return new HookRef(predicateId, index);
    }

    @Override
    public int compareTo(HookRef o) {
        int c = Integer.compare(predicateId, o.predicateId);
        return c != 0 ? c : Integer.compare(index, o.index);
    }

    @Override
    public String toString() {
        return predicateId + "#" + index;
    }
}
