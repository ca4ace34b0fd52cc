package com.nomadtap.tap.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.nomadtap.tap.model.Bookmark;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.ReplicationState;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.model.TapRecord;
import com.nomadtap.tap.service.NomadApiClient;
import com.nomadtap.tap.service.Page;
import com.nomadtap.tap.service.PageCursor;
import com.nomadtap.tap.service.RecordMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Extraction unit for one catalog entry.
 *
 * Every page is handled as one batch: all of its elements are converted first, then the accepted
 * records are emitted in API order, then exactly one STATE snapshot is committed. A page that fails
 * conversion emits nothing, so the last committed state always covers fully emitted data.
 */
@Slf4j
public abstract sealed class TapStream permits FullTableStream, IncrementalStream {

    protected final CatalogEntry entry;
    private final NomadApiClient client;
    private final RecordMapper mapper;
    private final Clock clock;

    protected TapStream(CatalogEntry entry, NomadApiClient client, RecordMapper mapper, Clock clock) {
        this.entry = entry;
        this.client = client;
        this.mapper = mapper;
        this.clock = clock;
    }

    public String name() {
        return entry.streamName();
    }

    public StreamDefinition definition() {
        return entry.definition();
    }

    /**
     * Extract this stream, reporting through the two callbacks.
     *
     * @param state       state the run currently holds; only this stream's bookmark is read or replaced
     * @param emitRecord  receives each accepted record
     * @param emitState   receives a full state snapshot after each page
     * @return the state after the last committed page
     */
    public final ReplicationState sync(ReplicationState state,
                                       Consumer<TapRecord> emitRecord,
                                       Consumer<ReplicationState> emitState) {
        Bookmark bookmark = state.bookmark(name());
        begin(bookmark);

        PageCursor cursor = client.fetchPages(definition().path(), requestParams());
        ReplicationState current = state;
        Optional<Page> next;
        while ((next = cursor.nextPage()).isPresent()) {
            Page page = next.get();
            Instant extractedAt = clock.instant();

            List<TapRecord> batch = new ArrayList<>(page.items().size());
            for (JsonNode raw : page.items()) {
                batch.add(mapper.map(raw, entry, extractedAt));
            }
            List<TapRecord> accepted = accept(batch);
            accepted.forEach(emitRecord);

            bookmark = checkpoint(bookmark, !page.hasNext());
            current = current.withBookmark(name(), bookmark);
            emitState.accept(current);

            log.debug("Stream {} page {}: {} fetched, {} emitted, bookmark {}",
                    name(), cursor.pagesRead(), batch.size(), accepted.size(), bookmark);
        }
        return current;
    }

    /** Called once before the first request with the bookmark the run starts from. */
    protected abstract void begin(Bookmark startBookmark);

    /** Query parameters for the listing, beyond paging and namespace. */
    protected abstract Map<String, String> requestParams();

    /** Records from one converted page that should be emitted, in order. */
    protected abstract List<TapRecord> accept(List<TapRecord> batch);

    /**
     * Bookmark to commit after a page.
     *
     * @param lastPage whether the listing has no further pages
     */
    protected abstract Bookmark checkpoint(Bookmark previous, boolean lastPage);
}
