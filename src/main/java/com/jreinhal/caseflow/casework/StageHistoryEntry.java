package com.jreinhal.caseflow.casework;

import java.time.Instant;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

/**
 * One stage occupancy interval. An entry with a null {@code exitedAt} is the stage the
 * case currently sits in.
 */
public record StageHistoryEntry(
    String stage,
    Instant enteredAt,
    Instant exitedAt,
    String notes,
    @Field(targetType = FieldType.OBJECT_ID) String changedBy
) {
    public static StageHistoryEntry open(String stage, Instant enteredAt, String notes, String changedBy) {
        return new StageHistoryEntry(stage, enteredAt, null, notes, changedBy);
    }

    public boolean isOpen() {
        return exitedAt == null;
    }

    public StageHistoryEntry closedAt(Instant timestamp) {
        return new StageHistoryEntry(stage, enteredAt, timestamp, notes, changedBy);
    }
}
