package org.tomasim.runtime;

/**
 * Size and speed of one functional-unit class.
 *
 * @param slots The number of reservation stations.
 * @param latency The execution latency in cycles.
 */
public record UnitShape(int slots, int latency) {

    public UnitShape {
        if (slots <= 0 || latency <= 0) {
            throw new IllegalArgumentException("Unit shape needs positive slots and latency: " + slots + "/" + latency);
        }
    }
}
