package com.atpwatcher.watcher.infrastructure.db.preference;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PreferenceJpaRepository extends JpaRepository<PreferenceEntity, String> {
}
