package org.tomasim.runtime;

/**
 * When control transfers with data-dependent targets are resolved.
 */
public enum BranchResolution {
    /**
     * Fetch falls through past BEQ and RET; the actual successor is known when the result is
     * broadcast, and younger wrong-path work is squashed then.
     */
    EXECUTE,
    /**
     * A BEQ (or RET) whose operands are ready at issue is evaluated immediately and fetch is
     * redirected without speculation. Otherwise it behaves as {@link #EXECUTE}.
     */
    ISSUE
}
