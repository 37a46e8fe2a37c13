package com.waste.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A waste-quantity submission recorded for a facility")
public class Submission {

    @Schema(description = "Unique submission identifier. Generated when not provided.", example = "SUB-7f3c2a")
    private String submissionId;

    @Schema(description = "Facility (subject) identifier", example = "FAC-001")
    private String subjectId;

    @Schema(description = "Reported waste quantity", example = "105.5")
    private Double quantity;

    @Schema(description = "Creation timestamp in epoch milliseconds. Defaults to current time if not provided.", example = "1760770800000")
    private long createdAt;
}
