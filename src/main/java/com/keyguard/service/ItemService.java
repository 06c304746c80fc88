package com.keyguard.service;

import com.keyguard.exception.InvalidRequestException;
import com.keyguard.exception.ResourceNotFoundException;
import com.keyguard.model.dto.ItemCreateRequest;
import com.keyguard.model.dto.ItemListResponse;
import com.keyguard.model.dto.ItemResponse;
import com.keyguard.model.dto.ItemUpdateRequest;
import com.keyguard.model.entity.Item;
import com.keyguard.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Service for item management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemService {

    private final ItemRepository itemRepository;
    private final Clock clock;

    /**
     * Create an item.
     *
     * @param request Item create request
     * @return Item response
     */
    @Transactional
    public Mono<ItemResponse> createItem(ItemCreateRequest request) {
        return Mono.fromCallable(() -> {
                    Instant now = Instant.now(clock);
                    return Item.builder()
                            .name(normalizeName(request.getName()))
                            .description(request.getDescription())
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                })
                .flatMap(itemRepository::save)
                .doOnNext(saved -> log.debug("Created item: id={}", saved.getId()))
                .map(ItemService::toResponse);
    }

    /**
     * Get an item.
     *
     * @param id Item ID
     * @return Item response
     */
    public Mono<ItemResponse> getItem(UUID id) {
        return itemRepository.findById(id)
                .map(ItemService::toResponse)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Item", id)));
    }

    /**
     * List items, newest first.
     *
     * @param skip Number of items to skip
     * @param limit Maximum number of items to return
     * @return Page of items with the total item count
     */
    public Mono<ItemListResponse> listItems(long skip, int limit) {
        Mono<List<ItemResponse>> page = itemRepository.findPage(skip, limit)
                .map(ItemService::toResponse)
                .collectList();
        Mono<Long> total = itemRepository.count();

        return Mono.zip(page, total)
                .map(tuple -> ItemListResponse.builder()
                        .items(tuple.getT1())
                        .total(tuple.getT2())
                        .skip(skip)
                        .limit(limit)
                        .build());
    }

    /**
     * Apply a partial update. Only the fields present in the request are
     * changed; {@link ItemUpdateRequest} accepts nothing but name and
     * description.
     *
     * @param id Item ID
     * @param request Partial update
     * @return Updated item
     */
    @Transactional
    public Mono<ItemResponse> updateItem(UUID id, ItemUpdateRequest request) {
        return itemRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Item", id)))
                .flatMap(existing -> {
                    for (String field : request.getPresentFields()) {
                        applyField(existing, field, request);
                    }
                    existing.setUpdatedAt(Instant.now(clock));
                    return itemRepository.save(existing);
                })
                .map(ItemService::toResponse);
    }

    /**
     * Delete an item.
     *
     * @param id Item ID
     * @return Mono<Void>
     */
    @Transactional
    public Mono<Void> deleteItem(UUID id) {
        return itemRepository.deleteItemById(id)
                .flatMap(rows -> rows > 0
                        ? Mono.<Void>empty()
                        : Mono.error(new ResourceNotFoundException("Item", id)));
    }

    /**
     * Convert entity to response DTO.
     */
    private static ItemResponse toResponse(Item item) {
        return ItemResponse.builder()
                .id(item.getId().toString())
                .name(item.getName())
                .description(item.getDescription())
                .createdAt(item.getCreatedAt())
                .updatedAt(item.getUpdatedAt())
                .build();
    }

    private static void applyField(Item item, String field, ItemUpdateRequest request) {
        switch (field) {
            case ItemUpdateRequest.NAME:
                item.setName(normalizeName(request.getName()));
                break;
            case ItemUpdateRequest.DESCRIPTION:
                item.setDescription(request.getDescription());
                break;
            default:
                throw new IllegalStateException("Unhandled item field: " + field);
        }
    }

    private static String normalizeName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRequestException("name", "Name cannot be empty or whitespace-only");
        }
        return trimmed;
    }
}
