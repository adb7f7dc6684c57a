package com.dvc.dispatch.api;

import com.dvc.core.orchestrator.ChallengeOrchestrator;
import com.dvc.core.orchestrator.FlagResult;
import com.dvc.core.orchestrator.FlagSubmission;
import com.dvc.core.orchestrator.OrchestrationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for flag submissions.
 */
@RestController
@RequestMapping("/api/v1/flags")
public class FlagController {

    private static final int MAX_BATCH = 50;

    private final ChallengeOrchestrator orchestrator;

    public FlagController(ChallengeOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<Object> submit(@RequestBody FlagSubmission submission) {
        try {
            return ResponseEntity.ok(orchestrator.validateFlagSubmission(submission.sessionId(), submission.flag()));
        } catch (OrchestrationException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * POST /api/v1/flags/batch: Validate up to 50 submissions; each result stands alone.
     */
    @PostMapping("/batch")
    public ResponseEntity<Object> submitBatch(@RequestBody FlagBatchRequest request) {
        if (request.submissions() != null && request.submissions().size() > MAX_BATCH) {
            return ApiErrors.badRequest("At most " + MAX_BATCH + " submissions per batch");
        }
        try {
            List<FlagResult> results = orchestrator.validateFlagBatch(request.submissions());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("results", results);
            body.put("valid", results.stream().filter(FlagResult::valid).count());
            body.put("total", results.size());
            return ResponseEntity.ok(body);
        } catch (OrchestrationException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
