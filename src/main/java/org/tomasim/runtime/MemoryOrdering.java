package org.tomasim.runtime;

/**
 * Ordering between LOADs and older STOREs.
 */
public enum MemoryOrdering {
    /**
     * A LOAD does not start executing while an older STORE is still uncommitted.
     */
    IN_ORDER,
    /**
     * A LOAD executes as soon as its address is known and may read a word an older,
     * uncommitted STORE is about to overwrite.
     */
    RELAXED
}
