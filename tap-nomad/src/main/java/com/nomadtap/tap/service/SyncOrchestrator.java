package com.nomadtap.tap.service;

import com.nomadtap.tap.error.TapException;
import com.nomadtap.tap.error.UnknownStreamException;
import com.nomadtap.tap.model.Bookmark;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.ReplicationState;
import com.nomadtap.tap.model.RunSummary;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.model.StreamRun;
import com.nomadtap.tap.model.StreamSelection;
import com.nomadtap.tap.model.StreamStatus;
import com.nomadtap.tap.model.SyncResult;
import com.nomadtap.tap.output.MessageWriter;
import com.nomadtap.tap.schema.SchemaRegistry;
import com.nomadtap.tap.stream.TapStream;
import com.nomadtap.tap.stream.StreamFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a sync run: streams execute one at a time in discovery order.
 *
 * A stream failure is logged, recorded in the summary and the run moves on to the next stream with
 * the state that stream last committed. Only fatal errors (corrupt state, unusable catalog,
 * broken output) escape.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncOrchestrator {

    private final SchemaRegistry registry;
    private final CatalogFilter catalogFilter;
    private final CatalogService catalogService;
    private final StateService stateService;
    private final StreamFactory streamFactory;
    private final MessageWriter writer;
    private final SyncCancellation cancellation;
    private final Clock clock;

    /**
     * Run every selected stream.
     *
     * @param userCatalog selections by stream name, or null to select every discovered stream
     * @param state       state the caller persisted after the previous run
     * @return the state to persist and the per-stream summary
     */
    public SyncResult sync(Map<String, StreamSelection> userCatalog, ReplicationState state) {
        String runId = UUID.randomUUID().toString();
        List<StreamDefinition> fullCatalog = registry.definitions();
        List<StreamRun> runs = new ArrayList<>();

        List<CatalogEntry> selected;
        List<String> unknown;
        if (userCatalog == null) {
            selected = catalogFilter.selectAll(fullCatalog);
            unknown = List.of();
        } else {
            selected = catalogFilter.select(fullCatalog, userCatalog);
            unknown = catalogFilter.unknownSelections(fullCatalog, userCatalog);
        }
        log.info("Starting sync run {} with {} streams: {}", runId, selected.size(),
                selected.stream().map(CatalogEntry::streamName).toList());

        ReplicationState current = state;
        boolean cancelled = false;
        for (CatalogEntry entry : selected) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                runs.add(cancelledStream(entry, current));
                continue;
            }
            StreamRun run = StreamRun.builder()
                    .stream(entry.streamName())
                    .startedAt(clock.instant())
                    .status(StreamStatus.RUNNING)
                    .lastBookmark(current.bookmark(entry.streamName()))
                    .build();
            runs.add(run);
            current = syncStream(entry, current, run);
        }
        // after the discovered streams, in name order
        for (String name : unknown) {
            runs.add(unknownStream(name, current));
        }

        writer.writeState(stateService.render(current));

        RunSummary summary = new RunSummary(runId, runs, cancelled);
        logSummary(summary);
        return new SyncResult(current, summary);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ReplicationState syncStream(CatalogEntry entry, ReplicationState state, StreamRun run) {
        String name = entry.streamName();
        StreamDefinition definition = entry.definition();
        ReplicationState[] committed = {state};

        try {
            writer.writeSchema(name, catalogService.renderSchema(entry), definition.primaryKeys(),
                    definition.replicationKey() != null ? List.of(definition.replicationKey()) : List.of());

            TapStream stream = streamFactory.create(entry);
            ReplicationState result = stream.sync(state,
                    record -> {
                        writer.writeRecord(record);
                        run.setRecordsEmitted(run.getRecordsEmitted() + 1);
                    },
                    snapshot -> {
                        writer.writeState(stateService.render(snapshot));
                        committed[0] = snapshot;
                        run.setBatchesCommitted(run.getBatchesCommitted() + 1);
                        run.setLastBookmark(snapshot.bookmark(name));
                    });

            run.setStatus(StreamStatus.SUCCEEDED);
            log.info("Stream {}: {} records in {} batches, bookmark {}",
                    name, run.getRecordsEmitted(), run.getBatchesCommitted(), run.getLastBookmark());
            return result;

        } catch (TapException e) {
            if (e.isFatal()) {
                throw e;
            }
            fail(run, e);
            log.error("Stream {} failed after {} committed batches; last committed bookmark {}: {}",
                    name, run.getBatchesCommitted(), run.getLastBookmark(), e.getMessage());
            return committed[0];

        } catch (RuntimeException e) {
            fail(run, e);
            log.error("Stream {} failed unexpectedly after {} committed batches; last committed bookmark {}",
                    name, run.getBatchesCommitted(), run.getLastBookmark(), e);
            return committed[0];

        } finally {
            run.setCompletedAt(clock.instant());
        }
    }

    private void fail(StreamRun run, RuntimeException e) {
        run.setStatus(StreamStatus.FAILED);
        run.setErrorType(e.getClass().getSimpleName());
        run.setErrorMessage(e.getMessage());
    }

    private StreamRun unknownStream(String name, ReplicationState state) {
        UnknownStreamException error = new UnknownStreamException(name);
        log.error("Stream {} is selected in the catalog but is not provided by this tap", name);
        return StreamRun.builder()
                .stream(name)
                .startedAt(clock.instant())
                .completedAt(clock.instant())
                .status(StreamStatus.FAILED)
                .lastBookmark(state.bookmark(name))
                .errorType(error.getClass().getSimpleName())
                .errorMessage(error.getMessage())
                .build();
    }

    private StreamRun cancelledStream(CatalogEntry entry, ReplicationState state) {
        log.warn("Skipping stream {}: run cancelled", entry.streamName());
        return StreamRun.builder()
                .stream(entry.streamName())
                .status(StreamStatus.CANCELLED)
                .lastBookmark(state.bookmark(entry.streamName()))
                .build();
    }

    private void logSummary(RunSummary summary) {
        log.info("Sync run {} finished: {} streams, {} records{}", summary.runId(), summary.streams().size(),
                summary.totalRecords(), summary.cancelled() ? " (cancelled)" : "");
        for (StreamRun run : summary.streams()) {
            log.info("  {} {} records={} batches={} bookmark={}", run.getStream(), run.getStatus(),
                    run.getRecordsEmitted(), run.getBatchesCommitted(), bookmarkOrNone(run.getLastBookmark()));
        }
        if (summary.hasFailures()) {
            log.warn("{} stream(s) failed; their bookmarks stay at the last safe point:", summary.failed().size());
            for (StreamRun run : summary.failed()) {
                log.warn("  {} [{}] {} (committed batches: {}, last safe bookmark: {})", run.getStream(),
                        run.getErrorType(), run.getErrorMessage(), run.getBatchesCommitted(),
                        bookmarkOrNone(run.getLastBookmark()));
            }
        }
    }

    private static String bookmarkOrNone(Bookmark bookmark) {
        return bookmark == null || bookmark.isEmpty() ? "none" : bookmark.toString();
    }
}
