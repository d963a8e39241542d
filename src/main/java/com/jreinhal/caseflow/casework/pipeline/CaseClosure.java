package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseOutcome;
import com.jreinhal.caseflow.casework.EndDetails;

public record CaseClosure(String caseId, String status, CaseOutcome outcome, EndDetails endDetails) {
}
