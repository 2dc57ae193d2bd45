package com.feetrail.routing;

/**
 * Result of one reconciliation attempt. Expected-but-unsuccessful steps are reported here, not thrown.
 */
public record RoutingOutcome(
        boolean hookRoutingUpdated,
        boolean hookRoutingBlockedByPoolAssigned,
        boolean lockerRoutingUpdated,
        EscrowAction escrowAction
) {

    public static RoutingOutcome noop() {
        return new RoutingOutcome(false, false, false, EscrowAction.NOOP);
    }
}
