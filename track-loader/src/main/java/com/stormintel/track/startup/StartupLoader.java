package com.stormintel.track.startup;

import com.stormintel.track.config.TrackLoaderProperties;
import com.stormintel.track.service.BestTrackLoadService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the configured files when the application starts, if asked to.
 *
 * Enable with RUN_ON_STARTUP=true or best-track.load.run-on-startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupLoader {

    private final BestTrackLoadService loadService;
    private final TrackLoaderProperties properties;

    @PostConstruct
    public void onStartup() {
        if (!properties.getLoad().isRunOnStartup()) {
            log.info("Loader ready. {} file(s) configured, trigger with POST /load/trigger",
                    properties.getInput().getFiles().size());
            return;
        }

        log.info("run-on-startup=true, loading {} configured file(s)", properties.getInput().getFiles().size());
        try {
            loadService.loadConfigured();
        } catch (RuntimeException e) {
            log.error("Startup load failed: {}", e.getMessage(), e);
        }
    }
}
