package com.waste.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Oversight dashboard summary of flagged submissions")
public class OversightDashboard {

    @Schema(description = "Anomaly records created today (fixed civil time zone)", example = "4")
    private long anomaliesToday;

    @Schema(description = "Most recent anomaly records, newest first")
    private List<AnomalyRecord> recent;

    @Schema(description = "Facilities with repeated anomalies in the trailing window", example = "[\"FAC-007\"]")
    private List<String> highRiskSubjects;
}
