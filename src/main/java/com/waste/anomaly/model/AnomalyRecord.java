package com.waste.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A flagged anomalous submission, visible to the oversight role only")
public class AnomalyRecord {

    @Schema(description = "Unique record identifier", example = "0d6f9c1e-4a57-4f0e-9a51-2b8f2f6f1c11")
    private String recordId;

    @Schema(description = "Facility (subject) identifier", example = "FAC-001")
    private String subjectId;

    @Schema(description = "Submission that triggered the record", example = "SUB-7f3c2a")
    private String submissionId;

    @Schema(description = "Submitted quantity", example = "150.0")
    private double quantity;

    @Schema(description = "Mean of the historical window", example = "102.0")
    private double mean;

    @Schema(description = "Sample standard deviation of the historical window", example = "5.7")
    private double stdDev;

    @JsonProperty("zScore")
    @Schema(description = "Signed z-score of the submitted quantity", example = "8.42")
    private double zScore;

    @Schema(description = "Always true for a stored record", example = "true")
    private boolean flagged;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1760770800000")
    private long createdAt;

    @Schema(description = "Key of the archived report, if one was stored", example = "FAC-001:1760770800000")
    private String reportKey;

    // Bean naming turns getZScore() into "zscore"; pin the accessor to the field's name
    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }
}
