package com.atpwatcher.watcher.infrastructure.db.target;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WatchTargetJpaRepository extends JpaRepository<WatchTargetEntity, String> {

    List<WatchTargetEntity> findByActiveTrueOrderByCreatedAtAsc();

    long countByActiveTrue();

    @Modifying
    @Query("UPDATE WatchTargetEntity t SET t.lastObservedValue = :value, t.lastSampleTime = :sampledAt, "
            + "t.thresholdLatched = :latched, t.updatedAt = :sampledAt WHERE t.id = :id")
    int updateSampleState(@Param("id") String id,
                          @Param("value") BigDecimal value,
                          @Param("sampledAt") Instant sampledAt,
                          @Param("latched") boolean latched);

    @Modifying
    @Query("UPDATE WatchTargetEntity t SET t.active = false, t.updatedAt = :at WHERE t.id = :id")
    int deactivate(@Param("id") String id, @Param("at") Instant at);
}
