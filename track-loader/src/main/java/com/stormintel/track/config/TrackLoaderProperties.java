package com.stormintel.track.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "best-track")
@Data
public class TrackLoaderProperties {

    private Input input = new Input();
    private Output output = new Output();
    private Load load = new Load();

    @Data
    public static class Input {
        /** HURDAT2 files, loaded and written in this order */
        private List<String> files = new ArrayList<>();
    }

    @Data
    public static class Output {
        private String dir = "/data/output";
        private boolean includeHeader = true;
    }

    @Data
    public static class Load {
        /** Abort the whole load on the first failed file, otherwise skip it and carry on */
        private boolean failFast = true;
        private int parallelism = 1;
        private boolean runOnStartup = false;
        private int historySize = 50;
    }
}
