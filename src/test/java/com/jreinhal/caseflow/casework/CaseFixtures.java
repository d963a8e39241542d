package com.jreinhal.caseflow.casework;

import com.jreinhal.caseflow.model.User;
import java.time.Instant;
import java.util.ArrayList;

public final class CaseFixtures {
    public static final String FIRM_ID = "5f0000000000000000000001";
    public static final String OTHER_FIRM_ID = "5f0000000000000000000002";
    public static final String LAWYER_ID = "5f00000000000000000000a1";
    public static final String COLLEAGUE_ID = "5f00000000000000000000a2";
    public static final String OUTSIDER_ID = "5f00000000000000000000b1";
    public static final String CASE_ID = "65a000000000000000000001";
    public static final Instant CREATED_AT = Instant.parse("2024-01-01T00:00:00Z");

    private CaseFixtures() {
    }

    public static User lawyer() {
        return new User(LAWYER_ID, "lawyer", FIRM_ID);
    }

    public static User colleague() {
        return new User(COLLEAGUE_ID, "colleague", FIRM_ID);
    }

    public static User outsider() {
        return new User(OUTSIDER_ID, "outsider", OTHER_FIRM_ID);
    }

    public static CaseRecord openCase(CaseCategory category, String currentStage) {
        CaseRecord record = new CaseRecord();
        record.setId(CASE_ID);
        record.setFirmId(FIRM_ID);
        record.setLawyerId(LAWYER_ID);
        record.setTitle("Test case");
        record.setCaseNumber("C-1");
        record.setCategory(category);
        record.setStatus(CaseStatus.OPEN);
        record.setCurrentStage(currentStage);
        record.setCreatedAt(CREATED_AT);
        record.setUpdatedAt(CREATED_AT);
        record.setStageHistory(new ArrayList<>());
        record.setNotes(new ArrayList<>());
        return record;
    }
}
