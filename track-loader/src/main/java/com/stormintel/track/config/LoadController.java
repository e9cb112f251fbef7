package com.stormintel.track.config;

import com.stormintel.track.model.LoadRun;
import com.stormintel.track.service.BestTrackLoadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class LoadController {

    private final BestTrackLoadService loadService;
    private final TrackLoaderProperties properties;

    @PostMapping("/load/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (loadService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "A load is already running"));
        }
        new Thread(this::runLoad, "manual-load").start();
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "files", String.valueOf(properties.getInput().getFiles().size())));
    }

    @GetMapping("/load/runs")
    public ResponseEntity<List<LoadRun>> runs() {
        return ResponseEntity.ok(loadService.recentRuns());
    }

    @GetMapping("/load/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "storm-intel-track-loader",
                "version", "1.0.0",
                "dataSource", "NHC HURDAT2 best track",
                "files", properties.getInput().getFiles(),
                "outputDir", properties.getOutput().getDir(),
                "running", loadService.isRunning()
        ));
    }

    private void runLoad() {
        try {
            loadService.loadConfigured();
        } catch (RuntimeException e) {
            log.error("Manual load failed: {}", e.getMessage(), e);
        }
    }
}
