package com.messenger.repair;

import org.springframework.data.cassandra.repository.Query;
import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface PendingFanoutRepository extends ReactiveCassandraRepository<PendingFanoutEntity, PendingFanoutKey> {

    @Query("SELECT * FROM pending_fanout WHERE bucket = ?0 LIMIT ?1")
    Flux<PendingFanoutEntity> findBatch(int bucket, int limit);
}
