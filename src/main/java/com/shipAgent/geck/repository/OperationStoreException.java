package com.shipAgent.geck.repository;

/**
 * Exception thrown when the operation store cannot be reached, read or written.
 */
public class OperationStoreException extends RuntimeException {
    
    public OperationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
