package org.lite.ai.store.impl;

import lombok.RequiredArgsConstructor;
import org.lite.ai.entity.CostRecord;
import org.lite.ai.repository.CostRecordRepository;
import org.lite.ai.store.CostRecordStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Component
@Profile("!in-memory")
@RequiredArgsConstructor
public class MongoCostRecordStore implements CostRecordStore {

    private final CostRecordRepository costRecordRepository;

    @Override
    public Mono<CostRecord> append(CostRecord record) {
        return costRecordRepository.insert(record);
    }

    @Override
    public Flux<CostRecord> findBetween(LocalDateTime from, LocalDateTime to) {
        return costRecordRepository.findByTimestampBetweenOrderByTimestampAsc(from, to);
    }
}
