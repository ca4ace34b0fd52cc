package com.nomadtap.tap.model;

/**
 * What a completed run hands back to the caller: the state to persist and the per-stream summary.
 */
public record SyncResult(ReplicationState finalState, RunSummary summary) {
}
