package com.keyguard.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of keys plus the total key count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyListResponse {
    private List<ApiKeyResponse> keys;
    private long total;
}
