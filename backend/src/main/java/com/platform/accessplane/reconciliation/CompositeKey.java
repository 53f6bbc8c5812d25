package com.platform.accessplane.reconciliation;

import java.util.Comparator;

/**
 * Identity of one API key / secret slot: a service account on a cluster.
 * Rendered as {@code saName~clusterId}.
 */
public record CompositeKey(String saName, String clusterId) implements Comparable<CompositeKey> {
    
    public static final String SEPARATOR = "~";
    
    private static final Comparator<CompositeKey> ORDER = Comparator
        .comparing(CompositeKey::saName)
        .thenComparing(CompositeKey::clusterId);
    
    public static CompositeKey of(String saName, String clusterId) {
        return new CompositeKey(saName, clusterId);
    }
    
    /**
     * Splits on the first separator only; cluster ids may not contain it but are not checked.
     */
    public static CompositeKey parse(String value) {
        int index = value.indexOf(SEPARATOR);
        if (index < 0) {
            throw new IllegalArgumentException("Not a composite key: " + value);
        }
        return new CompositeKey(value.substring(0, index), value.substring(index + SEPARATOR.length()));
    }
    
    @Override
    public int compareTo(CompositeKey other) {
        return ORDER.compare(this, other);
    }
    
    @Override
    public String toString() {
        return saName + SEPARATOR + clusterId;
    }
}
