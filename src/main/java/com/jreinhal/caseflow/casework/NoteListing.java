package com.jreinhal.caseflow.casework;

import java.util.List;

public record NoteListing(List<CaseNote> notes, Pagination pagination) {

    /** {@code total} counts the notes visible to the caller. */
    public record Pagination(int total, int limit, int offset) {
    }
}
