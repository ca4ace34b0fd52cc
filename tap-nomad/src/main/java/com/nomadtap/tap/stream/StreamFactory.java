package com.nomadtap.tap.stream;

import com.nomadtap.tap.config.TapNomadProperties;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.service.NomadApiClient;
import com.nomadtap.tap.service.RecordMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class StreamFactory {

    private final NomadApiClient client;
    private final RecordMapper mapper;
    private final Clock clock;
    private final TapNomadProperties properties;

    public TapStream create(CatalogEntry entry) {
        return switch (entry.definition().replicationMethod()) {
            case FULL_TABLE -> new FullTableStream(entry, client, mapper, clock);
            case INCREMENTAL -> new IncrementalStream(entry, client, mapper, clock,
                    properties.getSync().getStartIndex(), properties.getApi().isServerSideFilter());
        };
    }
}
