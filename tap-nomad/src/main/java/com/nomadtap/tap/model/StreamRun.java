package com.nomadtap.tap.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of one stream within a run. Collected into the {@link RunSummary}.
 */
@Data
@Builder
public class StreamRun {

    private String stream;
    private Instant startedAt;
    private Instant completedAt;
    private StreamStatus status;
    private long recordsEmitted;
    private int batchesCommitted;
    private Bookmark lastBookmark;      // last committed, or the starting bookmark if nothing committed
    private String errorType;           // null on success
    private String errorMessage;        // null on success

    public boolean isFailed() {
        return status == StreamStatus.FAILED;
    }
}
