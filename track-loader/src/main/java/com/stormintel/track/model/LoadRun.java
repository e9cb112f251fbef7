package com.stormintel.track.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks the processing of one source file for observability.
 * Never written into the bulk-load files.
 */
@Data
@Builder
public class LoadRun {

    private String runId;           // UUID
    private String sourceFile;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;
    private int stormCount;
    private int observationCount;
    private String errorMessage;    // null on success

    public enum Status {
        RUNNING, SUCCESS, FAILED
    }
}
