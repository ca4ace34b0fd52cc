package com.nomadtap.tap.stream;

import com.nomadtap.tap.model.Bookmark;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.TapRecord;
import com.nomadtap.tap.service.NomadApiClient;
import com.nomadtap.tap.service.RecordMapper;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Re-reads the whole collection every run. The bookmark only records whether the last listing
 * was read to the end.
 */
public final class FullTableStream extends TapStream {

    public FullTableStream(CatalogEntry entry, NomadApiClient client, RecordMapper mapper, Clock clock) {
        super(entry, client, mapper, clock);
    }

    @Override
    protected void begin(Bookmark startBookmark) {
        // nothing to resume from
    }

    @Override
    protected Map<String, String> requestParams() {
        return Map.of();
    }

    @Override
    protected List<TapRecord> accept(List<TapRecord> batch) {
        return batch;
    }

    @Override
    protected Bookmark checkpoint(Bookmark previous, boolean lastPage) {
        return Bookmark.empty().with(Bookmark.COMPLETED, lastPage);
    }
}
