package com.shipAgent.geck.dedup.exception;

/**
 * Exception thrown when a deduplication run names a survivor strategy that does not exist.
 * Raised before any duplicate group is read.
 */
public class InvalidStrategyException extends RuntimeException {
    
    public InvalidStrategyException(String message) {
        super(message);
    }
}
