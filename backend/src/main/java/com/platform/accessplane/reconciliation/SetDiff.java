package com.platform.accessplane.reconciliation;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Set difference primitives every reconciler is built from. Inputs are never modified.
 */
public final class SetDiff {
    
    private SetDiff() {
    }
    
    /**
     * Items declared but not observed.
     */
    public static <T> Set<T> toCreate(Set<T> declared, Set<T> observed) {
        Set<T> result = new LinkedHashSet<>(declared);
        result.removeAll(observed);
        return result;
    }
    
    /**
     * Items observed but no longer declared.
     */
    public static <T> Set<T> toDelete(Set<T> declared, Set<T> observed) {
        Set<T> result = new LinkedHashSet<>(observed);
        result.removeAll(declared);
        return result;
    }
    
    public static <T> Set<T> intersection(Set<T> left, Set<T> right) {
        Set<T> result = new LinkedHashSet<>(left);
        result.retainAll(right);
        return result;
    }
    
    public static <T> Set<T> union(Set<T> left, Set<T> right) {
        Set<T> result = new LinkedHashSet<>(left);
        result.addAll(right);
        return result;
    }
}
