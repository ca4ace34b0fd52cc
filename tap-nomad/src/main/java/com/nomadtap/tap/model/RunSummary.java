package com.nomadtap.tap.model;

import java.util.List;

public record RunSummary(String runId, List<StreamRun> streams, boolean cancelled) {

    public RunSummary {
        streams = List.copyOf(streams);
    }

    public List<StreamRun> failed() {
        return streams.stream().filter(StreamRun::isFailed).toList();
    }

    public boolean hasFailures() {
        return streams.stream().anyMatch(StreamRun::isFailed);
    }

    public long totalRecords() {
        return streams.stream().mapToLong(StreamRun::getRecordsEmitted).sum();
    }
}
