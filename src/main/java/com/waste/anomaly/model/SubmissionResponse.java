package com.waste.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement of a created submission. Same shape whatever happened during detection.")
public record SubmissionResponse(
        @Schema(example = "SUB-7f3c2a") String submissionId,
        @Schema(example = "FAC-001") String subjectId,
        @Schema(example = "105.5") double quantity,
        @Schema(example = "1760770800000") long createdAt,
        @Schema(example = "CREATED") String status) {

    public static SubmissionResponse created(Submission submission) {
        return new SubmissionResponse(
                submission.getSubmissionId(),
                submission.getSubjectId(),
                submission.getQuantity(),
                submission.getCreatedAt(),
                "CREATED");
    }
}
