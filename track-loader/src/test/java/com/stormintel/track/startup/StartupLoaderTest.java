package com.stormintel.track.startup;

import com.stormintel.track.config.TrackLoaderProperties;
import com.stormintel.track.exception.MalformedRecordException;
import com.stormintel.track.service.BestTrackLoadService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StartupLoaderTest {

    @Mock
    private BestTrackLoadService loadService;

    private TrackLoaderProperties properties;
    private StartupLoader underTest;

    @BeforeEach
    void setUp() {
        properties = new TrackLoaderProperties();
        underTest = new StartupLoader(loadService, properties);
    }

    @Test
    void shouldNotLoadByDefault() {
        underTest.onStartup();

        Mockito.verifyNoInteractions(loadService);
    }

    @Test
    void shouldLoadWhenRunOnStartup() {
        properties.getLoad().setRunOnStartup(true);

        underTest.onStartup();

        Mockito.verify(loadService).loadConfigured();
    }

    @Test
    void shouldNotFailStartupWhenLoadFails() {
        properties.getLoad().setRunOnStartup(true);
        Mockito.when(loadService.loadConfigured()).thenThrow(new MalformedRecordException(3, "Unparsable point count 'x'"));

        Assertions.assertDoesNotThrow(() -> underTest.onStartup());
    }
}
