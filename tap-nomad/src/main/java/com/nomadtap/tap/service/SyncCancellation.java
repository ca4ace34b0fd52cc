package com.nomadtap.tap.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal. Only consulted between streams; a stream that has started always runs
 * to completion or failure.
 */
@Slf4j
@Component
public class SyncCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Cancellation requested; the sync will stop before the next stream");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
