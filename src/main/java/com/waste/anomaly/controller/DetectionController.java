package com.waste.anomaly.controller;

import com.waste.anomaly.model.DetectionRequest;
import com.waste.anomaly.model.DetectionResponse;
import com.waste.anomaly.service.DetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/detect")
@Tag(name = "Detection", description = "Stateless z-score classification of one quantity against a history")
public class DetectionController {

    private final DetectionService detectionService;

    public DetectionController(DetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Classify a quantity",
            description = "Flags the quantity when |z| >= 2.5 against at least 5 numeric history values. " +
                    "Non-numeric history entries are ignored. Missing fields return 400.")
    @PostMapping
    public ResponseEntity<DetectionResponse> detect(@RequestBody DetectionRequest request) {
        return ResponseEntity.ok(detectionService.detect(request));
    }
}
