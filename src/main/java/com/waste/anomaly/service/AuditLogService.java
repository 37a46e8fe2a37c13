package com.waste.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waste.anomaly.model.DetectionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one JSON line per classification attempt to the {@code AUDIT} logger.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditLogService(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void recordClassification(String subjectId, double currentQuantity, DetectionOutcome outcome) {
        Map<String, Object> entry = buildEntry(subjectId, currentQuantity, outcome);
        try {
            audit.info(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Failed to write audit entry for subject={}: {}", subjectId, e.getMessage());
        }
    }

    Map<String, Object> buildEntry(String subjectId, double currentQuantity, DetectionOutcome outcome) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        entry.put("event", "classification");
        entry.put("subjectId", subjectId);
        entry.put("currentQuantity", currentQuantity);
        if (outcome instanceof DetectionOutcome.Detected detected) {
            entry.put("outcome", "DETECTED");
            entry.put("zScore", detected.verdict().zScore());
            entry.put("isAnomaly", detected.verdict().anomaly());
        } else if (outcome instanceof DetectionOutcome.Unavailable unavailable) {
            entry.put("outcome", "UNAVAILABLE");
            entry.put("zScore", null);
            entry.put("isAnomaly", false);
            entry.put("reason", unavailable.reason());
        }
        return entry;
    }
}
