package com.atpwatcher.watcher.infrastructure.db.history;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PriceHistoryJpaRepository extends JpaRepository<PriceHistoryEntity, Long> {

    List<PriceHistoryEntity> findByTargetIdOrderBySampledAtDescIdDesc(String targetId, Pageable pageable);

    @Modifying
    @Query(value = """
            DELETE FROM price_history WHERE id IN (
                SELECT ranked.id FROM (
                    SELECT id, ROW_NUMBER() OVER (PARTITION BY target_id ORDER BY sampled_at DESC, id DESC) AS rn
                    FROM price_history
                ) ranked
                WHERE ranked.rn > :keep
            )
            """, nativeQuery = true)
    int deleteBeyondNewest(@Param("keep") int keep);
}
