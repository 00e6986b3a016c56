package org.tomasim.runtime.station;

import org.tomasim.runtime.rob.RobEntry;

/**
 * A finished slot, ready to be put on the common data bus.
 *
 * @param handle The slot to release once the result is broadcast.
 * @param owner The producing reorder buffer entry.
 * @param result The result.
 */
public record CompletedResult(StationHandle handle, RobEntry owner, ExecutionResult result) {
}
