package com.waste.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Wire payload of the detection endpoint. History entries are left untyped so malformed samples
 * can be dropped instead of failing the whole request.
 */
@Schema(description = "Detection request: current quantity plus the facility's historical window")
public record DetectionRequest(
        @Schema(example = "FAC-001") String subjectId,
        @Schema(example = "150.0") Double currentQuantity,
        @Schema(example = "[100, 110, 105, 95, 100]") List<Object> history) {
}
