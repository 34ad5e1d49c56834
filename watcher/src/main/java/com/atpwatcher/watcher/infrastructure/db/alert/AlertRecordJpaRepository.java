package com.atpwatcher.watcher.infrastructure.db.alert;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AlertRecordJpaRepository extends JpaRepository<AlertRecordEntity, String> {

    List<AlertRecordEntity> findAllByOrderByTriggeredAtDescIdDesc(Pageable pageable);

    long countByDeliveredFalse();

    @Modifying
    @Query("UPDATE AlertRecordEntity a SET a.delivered = true WHERE a.id = :id")
    int markDelivered(@Param("id") String id);
}
