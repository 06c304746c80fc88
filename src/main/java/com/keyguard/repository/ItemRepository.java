package com.keyguard.repository;

import com.keyguard.model.entity.Item;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for Item entities.
 */
@Repository
public interface ItemRepository extends ReactiveCrudRepository<Item, UUID> {

    /**
     * One page of items, newest first.
     */
    @Query("SELECT * FROM items ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset")
    Flux<Item> findPage(long offset, int limit);

    /**
     * Delete by id.
     *
     * @return number of deleted rows
     */
    @Modifying
    @Query("DELETE FROM items WHERE id = :id")
    Mono<Integer> deleteItemById(UUID id);
}
