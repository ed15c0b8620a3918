package org.lite.ai.store;

import org.lite.ai.entity.CostRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Append-only log of provider attempts.
 */
public interface CostRecordStore {

    Mono<CostRecord> append(CostRecord record);

    Flux<CostRecord> findBetween(LocalDateTime from, LocalDateTime to);
}
