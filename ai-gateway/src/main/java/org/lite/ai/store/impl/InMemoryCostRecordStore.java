package org.lite.ai.store.impl;

import org.lite.ai.entity.CostRecord;
import org.lite.ai.store.CostRecordStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
@Profile("in-memory")
public class InMemoryCostRecordStore implements CostRecordStore {

    private final List<CostRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public Mono<CostRecord> append(CostRecord record) {
        return Mono.fromSupplier(() -> {
            if (record.getId() == null) {
                record.setId(UUID.randomUUID().toString());
            }
            records.add(record);
            return record;
        });
    }

    @Override
    public Flux<CostRecord> findBetween(LocalDateTime from, LocalDateTime to) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(records)))
                .filter(r -> !r.getTimestamp().isBefore(from) && !r.getTimestamp().isAfter(to));
    }

    public List<CostRecord> all() {
        return new ArrayList<>(records);
    }
}
