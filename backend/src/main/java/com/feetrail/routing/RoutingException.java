package com.feetrail.routing;

/**
 * Escrow assignment failed for a reason that is not an expected business condition.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
