package com.jreinhal.caseflow.casework.pipeline;

import java.util.List;
import java.util.Map;

public record PipelineListing(List<PipelineCaseView> cases, Pagination pagination, Summary statistics) {

    public record Pagination(int page, int limit, long total, long pages) {
        public static Pagination of(int page, int limit, long total) {
            return new Pagination(page, limit, total, (total + limit - 1) / limit);
        }
    }

    /** Counts over the whole filtered set, not just the returned page. */
    public record Summary(long total, Map<String, Long> byStage, Map<String, Long> byOutcome) {
    }
}
