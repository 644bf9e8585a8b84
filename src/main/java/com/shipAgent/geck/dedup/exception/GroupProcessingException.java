package com.shipAgent.geck.dedup.exception;

import lombok.Getter;

/**
 * Exception thrown when a single duplicate group cannot be merged, e.g. because one of
 * its member records is unreadable. The run skips the group and carries on.
 */
@Getter
public class GroupProcessingException extends RuntimeException {
    
    private final String groupName;
    
    public GroupProcessingException(String groupName, String message) {
        super(message);
        this.groupName = groupName;
    }
    
    public GroupProcessingException(String groupName, String message, Throwable cause) {
        super(message, cause);
        this.groupName = groupName;
    }
}
