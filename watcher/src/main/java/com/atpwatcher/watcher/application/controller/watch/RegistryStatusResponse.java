package com.atpwatcher.watcher.application.controller.watch;

import java.util.List;

public record RegistryStatusResponse(boolean running, int targetCount, List<WatchResponse> targets) {}
