package com.waste.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Detection verdict for one quantity")
public record DetectionResponse(
        @Schema(example = "FAC-001") String subjectId,
        @JsonProperty("isAnomaly") @Schema(example = "true") boolean anomaly,
        @Schema(example = "8.42") double zScore,
        @Schema(example = "102.0") double mean,
        @Schema(example = "5.7") double stdDev) {

    public static DetectionResponse of(String subjectId, Verdict verdict) {
        return new DetectionResponse(subjectId, verdict.anomaly(), verdict.zScore(), verdict.mean(), verdict.stdDev());
    }
}
