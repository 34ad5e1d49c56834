package com.atpwatcher.watcher.application.controller.watch;

import com.atpwatcher.watcher.application.controller.watch.mapper.WatchRequestResponseMapper;
import com.atpwatcher.watcher.application.service.WatchCommandHandler;
import com.atpwatcher.watcher.application.service.WatchQueryService;
import com.atpwatcher.watcher.domain.exceptions.WatchTargetNotFoundException;
import com.atpwatcher.watcher.domain.registry.WatcherRegistry;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/watches")
@RequiredArgsConstructor
public class WatchController {

    private final WatcherRegistry watcherRegistry;
    private final WatchCommandHandler commandHandler;
    private final WatchQueryService queryService;
    private final WatchRequestResponseMapper mapper;

    @GetMapping
    public List<WatchResponse> listWatches() {
        return watcherRegistry.status().targets().stream()
                .map(mapper::toResponse)
                .toList();
    }

    @GetMapping("/status")
    public RegistryStatusResponse status() {
        return mapper.toResponse(watcherRegistry.status());
    }

    @GetMapping("/{id}")
    public WatchResponse getWatch(@PathVariable String id) {
        return watcherRegistry.find(id)
                .map(mapper::toResponse)
                .orElseThrow(() -> WatchTargetNotFoundException.of(id));
    }

    @PostMapping
    public ResponseEntity<WatchResponse> addWatch(@Valid @RequestBody AddWatchRequest request) {
        var target = commandHandler.addWatch(request.toConfig());
        var status = watcherRegistry.find(target.id()).orElseThrow(() -> WatchTargetNotFoundException.of(target.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(status));
    }

    @PatchMapping("/{id}")
    public WatchResponse updateWatch(@PathVariable String id, @Valid @RequestBody UpdateWatchRequest request) {
        commandHandler.updateWatch(id, mapper.toUpdate(request));
        return getWatch(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeWatch(@PathVariable String id) {
        commandHandler.removeWatch(id);
    }

    @PostMapping("/{id}/start")
    public WatchResponse startWatch(@PathVariable String id) {
        return mapper.toResponse(commandHandler.startWatch(id));
    }

    @PostMapping("/{id}/stop")
    public WatchResponse stopWatch(@PathVariable String id) {
        return mapper.toResponse(commandHandler.stopWatch(id));
    }

    @GetMapping("/{id}/history")
    public List<PricePointResponse> history(@PathVariable String id, @RequestParam(defaultValue = "10") int limit) {
        return queryService.priceHistory(id, limit).stream()
                .map(mapper::toResponse)
                .toList();
    }
}
