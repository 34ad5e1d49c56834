package com.atpwatcher.watcher.application.controller.alert;

import com.atpwatcher.watcher.application.controller.alert.mapper.AlertResponseMapper;
import com.atpwatcher.watcher.application.service.WatchQueryService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AlertController {

    private final WatchQueryService queryService;
    private final AlertResponseMapper mapper;

    @GetMapping("/alerts")
    public List<AlertResponse> recentAlerts(@RequestParam(defaultValue = "50") int limit) {
        return queryService.recentAlerts(limit).stream()
                .map(mapper::toResponse)
                .toList();
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return mapper.toResponse(queryService.stats());
    }
}
