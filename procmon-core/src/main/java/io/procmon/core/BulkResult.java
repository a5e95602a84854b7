package io.procmon.core;

/**
 * Result of startAll/stopAll.
 *
 * total    : number of monitors in the registry
 * affected : number of monitors whose state changed
 */
public record BulkResult(
        int total,
        int affected
) {

    /**
     * True when there were no monitors at all.
     */
    public boolean isEmpty() {
        return total == 0;
    }

    public boolean hasEffect() {
        return affected > 0;
    }
}
