package com.peirce.eg.util;

import com.peirce.eg.api.EditListener;
import com.peirce.eg.api.EditOperation;

import java.util.Arrays;
import java.util.List;

/**
 * Fans one editor notification out to several {@link EditListener}s, in
 * registration order.
 */
public class CompositeEditListener implements EditListener {
    private EditListener[] listeners = new EditListener[0];

    public void addForComposite(EditListener listener) {
        EditListener[] old = listeners;
        EditListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onEdit(EditOperation operation, List<Integer> affected) {
        for (EditListener l : listeners)
            l.onEdit(operation, affected);
    }
}
