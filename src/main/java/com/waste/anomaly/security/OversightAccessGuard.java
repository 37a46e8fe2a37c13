package com.waste.anomaly.security;

import com.waste.anomaly.config.DetectionConfig;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gate for oversight-only data. The caller's role is asserted by the upstream authentication
 * layer in a request header; this guard only compares it with the configured oversight role.
 */
@Component
public class OversightAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(OversightAccessGuard.class);

    private final DetectionConfig config;

    public OversightAccessGuard(DetectionConfig config) {
        this.config = config;
    }

    public void requireOversight(HttpServletRequest request) {
        DetectionConfig.Oversight oversight = config.getOversight();
        String role = request.getHeader(oversight.getRoleHeader());
        if (role == null || !oversight.getRole().equalsIgnoreCase(role.trim())) {
            log.info("Denied oversight access to {} for role={}", request.getRequestURI(), role);
            throw new OversightAccessDeniedException("Oversight role required");
        }
    }
}
