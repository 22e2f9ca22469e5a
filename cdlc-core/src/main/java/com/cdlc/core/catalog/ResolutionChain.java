package com.cdlc.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable stack of composite blocks currently being resolved.
 *
 * <p>Passed explicitly down the resolution so that a block requiring itself, directly or
 * through nested composites, is detected without shared mutable state.
 *
 * @param head qualified name on top of the stack, or {@code null} for the empty chain
 * @param tail rest of the chain, or {@code null}
 */
public record ResolutionChain(
    String head,
    ResolutionChain tail
) {
    private static final ResolutionChain EMPTY = new ResolutionChain(null, null);

    public static ResolutionChain empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return head == null;
    }

    public ResolutionChain push(String qualifiedName) {
        return new ResolutionChain(qualifiedName, this);
    }

    public boolean contains(String qualifiedName) {
        for (ResolutionChain c = this; c != null && !c.isEmpty(); c = c.tail) {
            if (c.head.equals(qualifiedName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the chain from the outermost to the innermost block.
     *
     * @return qualified names in resolution order
     */
    public List<String> path() {
        List<String> result = new ArrayList<>();
        for (ResolutionChain c = this; c != null && !c.isEmpty(); c = c.tail) {
            result.add(c.head);
        }
        Collections.reverse(result);
        return result;
    }
}
