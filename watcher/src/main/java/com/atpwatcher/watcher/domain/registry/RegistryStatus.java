package com.atpwatcher.watcher.domain.registry;

import java.util.List;

public record RegistryStatus(boolean running, int targetCount, List<TargetStatus> targets) {
}
