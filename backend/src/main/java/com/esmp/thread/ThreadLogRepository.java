package com.esmp.thread;

import org.springframework.data.cassandra.repository.Query;
import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ThreadLogRepository extends ReactiveCassandraRepository<ThreadEntryEntity, ThreadEntryKey> {

    @Query("SELECT * FROM thread_log WHERE thread_key = ?0 ORDER BY seq DESC LIMIT 1")
    Mono<ThreadEntryEntity> findLatest(String threadKey);

    // Clustering order is ascending, so rows come back in sequence order.
    @Query("SELECT * FROM thread_log WHERE thread_key = ?0 AND seq >= ?1 AND seq <= ?2")
    Flux<ThreadEntryEntity> findRange(String threadKey, long fromSeq, long toSeq);
}
