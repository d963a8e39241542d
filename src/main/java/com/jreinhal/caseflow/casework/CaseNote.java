package com.jreinhal.caseflow.casework;

import java.time.Instant;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

public record CaseNote(
    @Field(targetType = FieldType.OBJECT_ID) String id,
    String text,
    Instant date,
    @Field(targetType = FieldType.OBJECT_ID) String createdBy,
    Instant createdAt,
    Instant updatedAt,
    boolean isPrivate,
    String stageId
) {
    public boolean isCreatedBy(String userId) {
        return createdBy != null && createdBy.equals(userId);
    }

    /** Private notes are only listed for their creator. */
    public boolean isVisibleTo(String userId) {
        return !isPrivate || isCreatedBy(userId);
    }

    public CaseNote withText(String newText, Instant timestamp) {
        return new CaseNote(id, newText, date, createdBy, createdAt, timestamp, isPrivate, stageId);
    }

    public CaseNote withPrivacy(boolean privateNote, Instant timestamp) {
        return new CaseNote(id, text, date, createdBy, createdAt, timestamp, privateNote, stageId);
    }
}
