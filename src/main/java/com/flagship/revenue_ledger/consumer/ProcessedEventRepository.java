package com.flagship.revenue_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    /**
     * Processing history of one payment transaction, for investigations.
     */
    List<ProcessedEventEntity> findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(
        String aggregateType, String aggregateId);

    @Query("""
        SELECT COUNT(e) FROM ProcessedEventEntity e
        WHERE e.consumerGroup = :consumerGroup
        AND e.processingResult = 'FAILED'
        """)
    long countFailedByConsumerGroup(@Param("consumerGroup") String consumerGroup);
}
