package com.jreinhal.caseflow.casework.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "caseflow.pipeline")
public class PipelineProperties {
    /**
     * Per-category stage overrides, keyed by category key. A category that is absent or
     * mapped to an empty list keeps the built-in stages.
     *
     * Example:
     * caseflow.pipeline.stages.labor[0]=filing
     */
    private Map<String, List<String>> stages = new LinkedHashMap<>();

    /**
     * Upper bound for the pipeline list page size.
     */
    private int maxPageSize = 200;

    /**
     * Upper bound for the note list page size.
     */
    private int maxNotePageSize = 200;

    public Map<String, List<String>> getStages() {
        return stages;
    }

    public void setStages(Map<String, List<String>> stages) {
        this.stages = stages;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public int getMaxNotePageSize() {
        return maxNotePageSize;
    }

    public void setMaxNotePageSize(int maxNotePageSize) {
        this.maxNotePageSize = maxNotePageSize;
    }
}
