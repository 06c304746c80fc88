package com.keyguard.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a page of items with pagination info.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemListResponse {
    private List<ItemResponse> items;
    private long total;
    private long skip;
    private int limit;
}
