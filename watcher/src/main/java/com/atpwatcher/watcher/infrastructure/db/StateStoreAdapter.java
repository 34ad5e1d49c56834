package com.atpwatcher.watcher.infrastructure.db;

import com.atpwatcher.watcher.domain.alert.AlertRecord;
import com.atpwatcher.watcher.domain.store.PriceHistoryPoint;
import com.atpwatcher.watcher.domain.store.StateStore;
import com.atpwatcher.watcher.domain.store.StoreStats;
import com.atpwatcher.watcher.domain.target.WatchTarget;
import com.atpwatcher.watcher.infrastructure.db.alert.AlertRecordJpaRepository;
import com.atpwatcher.watcher.infrastructure.db.alert.mapper.AlertRecordEntityMapper;
import com.atpwatcher.watcher.infrastructure.db.history.PriceHistoryJpaRepository;
import com.atpwatcher.watcher.infrastructure.db.history.mapper.PriceHistoryEntityMapper;
import com.atpwatcher.watcher.infrastructure.db.preference.PreferenceEntity;
import com.atpwatcher.watcher.infrastructure.db.preference.PreferenceJpaRepository;
import com.atpwatcher.watcher.infrastructure.db.target.WatchTargetJpaRepository;
import com.atpwatcher.watcher.infrastructure.db.target.mapper.WatchTargetEntityMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class StateStoreAdapter implements StateStore {

    private final WatchTargetJpaRepository targetRepository;
    private final AlertRecordJpaRepository alertRepository;
    private final PriceHistoryJpaRepository historyRepository;
    private final PreferenceJpaRepository preferenceRepository;
    private final WatchTargetEntityMapper targetMapper;
    private final AlertRecordEntityMapper alertMapper;
    private final PriceHistoryEntityMapper historyMapper;
    private final Clock clock;

    @Override
    @Transactional
    public WatchTarget saveTarget(WatchTarget target) {
        var saved = targetRepository.save(targetMapper.toEntity(target));
        return targetMapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WatchTarget> findTarget(String id) {
        return targetRepository.findById(id).map(targetMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WatchTarget> findActiveTargets() {
        return targetRepository.findByActiveTrueOrderByCreatedAtAsc().stream()
                .map(targetMapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void updateSampleState(String id, BigDecimal value, Instant sampledAt, boolean thresholdLatched) {
        targetRepository.updateSampleState(id, value, sampledAt, thresholdLatched);
    }

    @Override
    @Transactional
    public void deactivateTarget(String id, Instant at) {
        targetRepository.deactivate(id, at);
    }

    @Override
    @Transactional
    public void appendAlert(AlertRecord alert) {
        alertRepository.save(alertMapper.toEntity(alert));
    }

    @Override
    @Transactional
    public void markAlertDelivered(String alertId) {
        alertRepository.markDelivered(alertId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AlertRecord> findRecentAlerts(int limit) {
        return alertRepository.findAllByOrderByTriggeredAtDescIdDesc(PageRequest.of(0, limit)).stream()
                .map(alertMapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void appendPriceHistory(PriceHistoryPoint point) {
        historyRepository.save(historyMapper.toEntity(point));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PriceHistoryPoint> findPriceHistory(String targetId, int limit) {
        return historyRepository.findByTargetIdOrderBySampledAtDescIdDesc(targetId, PageRequest.of(0, limit)).stream()
                .map(historyMapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public int pruneHistory(int keepPerTarget) {
        return historyRepository.deleteBeyondNewest(keepPerTarget);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> getPreference(String key) {
        return preferenceRepository.findById(key).map(PreferenceEntity::getValue);
    }

    @Override
    @Transactional
    public void setPreference(String key, String value) {
        preferenceRepository.save(PreferenceEntity.builder()
                .key(key)
                .value(value)
                .updatedAt(clock.instant())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public StoreStats stats() {
        return StoreStats.builder()
                .targets(targetRepository.count())
                .activeTargets(targetRepository.countByActiveTrue())
                .alerts(alertRepository.count())
                .undeliveredAlerts(alertRepository.countByDeliveredFalse())
                .historyPoints(historyRepository.count())
                .build();
    }
}
