package com.jreinhal.caseflow.casework;

public record ClientSummary(String id, String name, String phone) {
}
