package com.waste.anomaly.controller;

import com.waste.anomaly.model.PagedResponse;
import com.waste.anomaly.model.Submission;
import com.waste.anomaly.model.SubmissionOutcome;
import com.waste.anomaly.model.SubmissionResponse;
import com.waste.anomaly.service.SubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/submissions")
@Tag(name = "Submissions", description = "Record waste-quantity submissions and list a facility's own history")
public class SubmissionController {

    private final SubmissionService submissionService;

    public SubmissionController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @Operation(summary = "Record a waste-quantity submission",
            description = "Stores the submission and screens it for anomalies. The response only reflects " +
                    "whether the submission was stored; detection outcomes are never exposed here.")
    @PostMapping
    public ResponseEntity<SubmissionResponse> createSubmission(@RequestBody Submission submission) {
        SubmissionOutcome outcome = submissionService.submit(submission);
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionResponse.created(outcome.submission()));
    }

    @Operation(summary = "Get a submission by ID")
    @GetMapping("/{submissionId}")
    public ResponseEntity<Submission> getSubmission(
            @Parameter(description = "Submission ID", example = "SUB-7f3c2a")
            @PathVariable String submissionId) {
        Submission submission = submissionService.getSubmission(submissionId);
        if (submission == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(submission);
    }

    @Operation(summary = "List a facility's submissions",
            description = "Newest first, cursor paginated. Contains submission fields only.")
    @GetMapping("/subject/{subjectId}")
    public ResponseEntity<PagedResponse<Submission>> getSubmissionsBySubject(
            @Parameter(description = "Facility ID", example = "FAC-001")
            @PathVariable String subjectId,
            @Parameter(description = "Max number of submissions to return", example = "50")
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor: return submissions created before this value")
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(submissionService.getSubmissionsBySubject(subjectId, limit, before));
    }
}
