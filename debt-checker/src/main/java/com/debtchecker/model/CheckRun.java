package com.debtchecker.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Summary of one check run, logged at the end and exposed on the status endpoint.
 */
@Data
@Builder
public class CheckRun {

    private String runId;           // UUID
    private String inputFile;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private RunStatus status;
    private int identifiersRead;
    private int queried;
    private int found;
    private int notFound;
    private int failed;
    private int remaining;
    private String errorMessage;    // null unless FATAL or FAILED

    public enum RunStatus {
        RUNNING, COMPLETED, PARTIAL, FATAL, FAILED
    }
}
