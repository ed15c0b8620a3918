package org.lite.ai.repository;

import org.lite.ai.entity.CostRecord;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface CostRecordRepository extends ReactiveMongoRepository<CostRecord, String> {

    Flux<CostRecord> findByTimestampBetweenOrderByTimestampAsc(LocalDateTime from, LocalDateTime to);
}
