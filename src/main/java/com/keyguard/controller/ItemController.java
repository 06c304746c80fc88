package com.keyguard.controller;

import com.keyguard.model.dto.ItemCreateRequest;
import com.keyguard.model.dto.ItemListResponse;
import com.keyguard.model.dto.ItemResponse;
import com.keyguard.model.dto.ItemUpdateRequest;
import com.keyguard.service.ItemService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for item CRUD. Every endpoint requires a valid API key.
 */
@Validated
@RestController
@RequestMapping("/api/v1/items")
@RequiredArgsConstructor
public class ItemController {

    private final ItemService itemService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ItemResponse> createItem(@Valid @RequestBody ItemCreateRequest request) {
        return itemService.createItem(request);
    }

    @GetMapping
    public Mono<ItemListResponse> listItems(
            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Skip must be at least 0")
            @Max(value = 1000, message = "Skip cannot exceed 1000") long skip,
            @RequestParam(defaultValue = "50")
            @Min(value = 1, message = "Limit must be at least 1")
            @Max(value = 100, message = "Limit cannot exceed 100") int limit) {
        return itemService.listItems(skip, limit);
    }

    @GetMapping("/{itemId}")
    public Mono<ItemResponse> getItem(@PathVariable UUID itemId) {
        return itemService.getItem(itemId);
    }

    @PatchMapping("/{itemId}")
    public Mono<ItemResponse> updateItem(
            @PathVariable UUID itemId,
            @Valid @RequestBody ItemUpdateRequest request) {
        return itemService.updateItem(itemId, request);
    }

    @DeleteMapping("/{itemId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteItem(@PathVariable UUID itemId) {
        return itemService.deleteItem(itemId);
    }
}
