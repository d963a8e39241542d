package com.jreinhal.caseflow.casework;

import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

public record EndDetails(
    Instant endDate,
    String endReason,
    @Field(targetType = FieldType.DECIMAL128) BigDecimal finalAmount,
    String notes,
    @Field(targetType = FieldType.OBJECT_ID) String endedBy
) {
}
