package com.nomadtap.tap.stream;

import com.nomadtap.tap.error.MalformedRecordException;
import com.nomadtap.tap.model.Bookmark;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.TapRecord;
import com.nomadtap.tap.service.NomadApiClient;
import com.nomadtap.tap.service.RecordMapper;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Emits only rows past the bookmark and tracks the highest replication key value seen.
 *
 * The floor is fixed when the stream starts: with a committed bookmark only values strictly above
 * it pass, otherwise values at or above the configured start index pass. Filtering always happens
 * here; the server-side filter is an optional narrowing of what gets fetched.
 *
 * For sources not sorted by the replication key the committed value stays at the floor while the
 * run is in flight and the running maximum is kept under {@code progress_markers}. It is promoted
 * on the last page only, so resuming after a crash can never skip rows from unread pages.
 */
public final class IncrementalStream extends TapStream {

    private final long startIndex;
    private final boolean serverSideFilter;

    private Long floor;
    private boolean floorInclusive;
    private Long maxSeen;

    public IncrementalStream(CatalogEntry entry, NomadApiClient client, RecordMapper mapper, Clock clock,
                             long startIndex, boolean serverSideFilter) {
        super(entry, client, mapper, clock);
        this.startIndex = startIndex;
        this.serverSideFilter = serverSideFilter;
    }

    private String replicationKey() {
        return definition().replicationKey();
    }

    @Override
    protected void begin(Bookmark startBookmark) {
        var committed = startBookmark.getLong(replicationKey());
        if (committed.isPresent()) {
            floor = committed.get();
            floorInclusive = false;
        } else {
            floor = startIndex;
            floorInclusive = true;
        }
        maxSeen = committed.orElse(null);
    }

    @Override
    protected Map<String, String> requestParams() {
        if (!serverSideFilter) {
            return Map.of();
        }
        return Map.of("filter", replicationKey() + (floorInclusive ? " >= " : " > ") + floor);
    }

    @Override
    protected List<TapRecord> accept(List<TapRecord> batch) {
        List<TapRecord> accepted = new ArrayList<>(batch.size());
        for (TapRecord record : batch) {
            Object value = record.values().get(replicationKey());
            if (!(value instanceof Long index)) {
                throw new MalformedRecordException(name(), "replication key " + replicationKey() + " is missing");
            }
            if (floorInclusive ? index >= floor : index > floor) {
                accepted.add(record);
                if (maxSeen == null || index > maxSeen) {
                    maxSeen = index;
                }
            }
        }
        return accepted;
    }

    @Override
    protected Bookmark checkpoint(Bookmark previous, boolean lastPage) {
        Bookmark committed = previous.without(Bookmark.PROGRESS_MARKERS);
        if (maxSeen == null) {
            return committed;
        }
        if (definition().sorted() || lastPage) {
            return committed.with(replicationKey(), maxSeen);
        }
        return committed.with(Bookmark.PROGRESS_MARKERS, Map.of(replicationKey(), maxSeen));
    }
}
