package com.peirce.eg.api;

import java.util.List;

/**
 * Observer of successful editor mutations.
 *
 * <p>
 * A presentation layer registers one of these to learn when to re-read model
 * state. Callbacks run synchronously on the editing thread after the mutation
 * is complete; they are never invoked for a rejected operation.
 */
@FunctionalInterface
public interface EditListener {

    /**
     * Called after an operation has been fully applied.
     *
     * @param operation The operation that ran.
     * @param affected  Ids created, moved or removed by it (never null).
     */
    void onEdit(EditOperation operation, List<Integer> affected);
}
