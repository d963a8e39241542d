package com.jreinhal.caseflow.casework.pipeline;

import com.jreinhal.caseflow.casework.CaseCategory;
import com.jreinhal.caseflow.filter.SecurityContext;
import com.jreinhal.caseflow.model.User;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/cases"})
public class CasePipelineController {
    private final CaseStageEngine stageEngine;
    private final PipelineQueryService queryService;
    private final StageVocabulary vocabulary;

    public CasePipelineController(CaseStageEngine stageEngine, PipelineQueryService queryService, StageVocabulary vocabulary) {
        this.stageEngine = stageEngine;
        this.queryService = queryService;
        this.vocabulary = vocabulary;
    }

    @GetMapping(value={"/pipeline"})
    public ResponseEntity<Map<String, Object>> listCasesForPipeline(@RequestParam(required=false) String category,
                                                                    @RequestParam(required=false) String outcome,
                                                                    @RequestParam(required=false) String priority,
                                                                    @RequestParam(required=false) Integer page,
                                                                    @RequestParam(required=false) Integer limit) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        PipelineListing listing = queryService.listCases(user, new PipelineFilter(category, outcome, priority), page, limit);
        Map<String, Object> body = success();
        body.put("cases", listing.cases());
        body.put("pagination", listing.pagination());
        body.put("statistics", listing.statistics());
        return ResponseEntity.ok(body);
    }

    @GetMapping(value={"/pipeline/grouped"})
    public ResponseEntity<Map<String, Object>> getCasesGroupedByStage(@RequestParam(required=false) String category,
                                                                      @RequestParam(required=false) String status) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        Map<String, Object> body = success();
        body.put("data", queryService.groupByStage(user, category, status));
        return ResponseEntity.ok(body);
    }

    @GetMapping(value={"/pipeline/statistics"})
    public ResponseEntity<Map<String, Object>> getPipelineStatistics(@RequestParam(required=false) String category,
                                                                     @RequestParam(required=false) String dateFrom,
                                                                     @RequestParam(required=false) String dateTo) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        Map<String, Object> body = success();
        body.put("statistics", queryService.statistics(user, category, dateFrom, dateTo));
        return ResponseEntity.ok(body);
    }

    @GetMapping(value={"/pipeline/stages/{category}"})
    public ResponseEntity<Map<String, Object>> getValidStages(@PathVariable String category) {
        String categoryKey = category == null || category.isBlank() ? CaseCategory.OTHER.getKey() : category.trim().toLowerCase(Locale.ROOT);
        List<String> stages = stageEngine.validStages(categoryKey);
        Map<String, Object> body = success();
        body.put("category", categoryKey);
        body.put("stages", stages);
        body.put("allCategories", vocabulary.allCategories());
        return ResponseEntity.ok(body);
    }

    @PutMapping(value={"/{caseId}/stage"})
    public ResponseEntity<Map<String, Object>> moveCaseToStage(@PathVariable String caseId, @RequestBody MoveStageRequest request) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        StageTransition transition = stageEngine.moveToStage(caseId, request.newStage(), request.notes(), user);
        Map<String, Object> body = success();
        body.put("message", "Case moved to the new stage");
        body.put("messageAr", "تم نقل القضية إلى المرحلة الجديدة");
        body.put("case", transition);
        return ResponseEntity.ok(body);
    }

    @PutMapping(value={"/{caseId}/end"})
    public ResponseEntity<Map<String, Object>> endCase(@PathVariable String caseId, @RequestBody EndCaseCommand request) {
        User user = SecurityContext.getCurrentUser();
        if (user == null) {
            return ResponseEntity.status((HttpStatusCode)HttpStatus.UNAUTHORIZED).build();
        }
        CaseClosure closure = stageEngine.endCase(caseId, request, user);
        Map<String, Object> body = success();
        body.put("message", "Case ended successfully");
        body.put("messageAr", "تم إنهاء القضية بنجاح");
        body.put("case", closure);
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", false);
        return body;
    }

    public record MoveStageRequest(String newStage, String notes) {
    }
}
