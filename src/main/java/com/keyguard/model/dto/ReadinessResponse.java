package com.keyguard.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Readiness check result with per-dependency checks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadinessResponse {
    private String status;
    private Map<String, String> checks;
}
