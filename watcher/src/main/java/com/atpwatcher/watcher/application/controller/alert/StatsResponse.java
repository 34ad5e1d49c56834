package com.atpwatcher.watcher.application.controller.alert;

public record StatsResponse(long targets, long activeTargets, long alerts, long undeliveredAlerts, long historyPoints) {}
