package com.jreinhal.caseflow.casework.pipeline;

/**
 * End-case input as received. {@code finalAmount} may be a JSON number or a numeric
 * string; {@code endDate} is an ISO-8601 instant or calendar date.
 */
public record EndCaseCommand(String outcome, String endReason, Object finalAmount, String notes, String endDate) {
}
