package com.shipAgent.geck.dedup.model;

import com.shipAgent.geck.operations.model.OperationRecord;

/**
 * A duplicate-group member tagged with the position it was read at.
 * The sequence breaks ties between records that compare equal under a strategy.
 */
public record GroupMember(int sequence, OperationRecord operation) {
}
