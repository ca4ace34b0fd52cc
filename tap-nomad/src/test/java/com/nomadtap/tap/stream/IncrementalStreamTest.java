package com.nomadtap.tap.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomadtap.tap.error.MalformedRecordException;
import com.nomadtap.tap.model.Bookmark;
import com.nomadtap.tap.model.CatalogEntry;
import com.nomadtap.tap.model.FieldType;
import com.nomadtap.tap.model.ReplicationState;
import com.nomadtap.tap.model.StreamDefinition;
import com.nomadtap.tap.model.TapRecord;
import com.nomadtap.tap.schema.NomadStreams;
import com.nomadtap.tap.service.RecordMapper;
import com.nomadtap.tap.service.ScriptedNomadApiClient;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IncrementalStreamTest {

    private static final StreamDefinition SORTED_EVENTS = StreamDefinition.builder("events")
            .path("/v1/events")
            .field("ID", FieldType.STRING)
            .field("ModifyIndex", FieldType.INTEGER)
            .primaryKeys("ID")
            .incremental("ModifyIndex")
            .sorted(true)
            .build();

    private final ScriptedNomadApiClient api = new ScriptedNomadApiClient();
    private final RecordMapper mapper = new RecordMapper(new ObjectMapper());
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    private final List<TapRecord> records = new ArrayList<>();
    private final List<ReplicationState> states = new ArrayList<>();

    @Test
    void firstRunStartsAtTheConfiguredIndexInclusive() {
        api.page("/v1/deployments", "[{\"ID\":\"d1\",\"ModifyIndex\":4},{\"ID\":\"d2\",\"ModifyIndex\":5},{\"ID\":\"d3\",\"ModifyIndex\":9}]");

        ReplicationState result = stream(NomadStreams.DEPLOYMENTS, 5, false).sync(ReplicationState.empty(), records::add, states::add);

        assertThat(records).extracting(r -> r.values().get("ID")).containsExactly("d2", "d3");
        assertThat(result.bookmark("deployments").getLong("ModifyIndex")).contains(9L);
    }

    @Test
    void committedBookmarkIsExclusive() {
        api.page("/v1/deployments", "[{\"ID\":\"d1\",\"ModifyIndex\":10},{\"ID\":\"d2\",\"ModifyIndex\":11},{\"ID\":\"d3\",\"ModifyIndex\":3}]");
        ReplicationState start = ReplicationState.empty()
                .withBookmark("deployments", Bookmark.empty().with("ModifyIndex", 10L));

        ReplicationState result = stream(NomadStreams.DEPLOYMENTS, 0, false).sync(start, records::add, states::add);

        assertThat(records).extracting(r -> r.values().get("ID")).containsExactly("d2");
        assertThat(result.bookmark("deployments").getLong("ModifyIndex")).contains(11L);
    }

    @Test
    void unchangedSourceProducesNoRecordsAndKeepsTheBookmark() {
        api.page("/v1/deployments", "[{\"ID\":\"d1\",\"ModifyIndex\":10},{\"ID\":\"d2\",\"ModifyIndex\":8}]");
        ReplicationState start = ReplicationState.empty()
                .withBookmark("deployments", Bookmark.empty().with("ModifyIndex", 10L));

        ReplicationState result = stream(NomadStreams.DEPLOYMENTS, 0, false).sync(start, records::add, states::add);

        assertThat(records).isEmpty();
        assertThat(result.bookmark("deployments")).isEqualTo(start.bookmark("deployments"));
    }

    @Test
    void unsortedSourceKeepsRunningMaximumInProgressMarkersUntilTheLastPage() {
        api.page("/v1/jobs", "[{\"ID\":\"a\",\"Namespace\":\"default\",\"ModifyIndex\":30},{\"ID\":\"b\",\"Namespace\":\"default\",\"ModifyIndex\":10}]")
                .page("/v1/jobs", "[{\"ID\":\"c\",\"Namespace\":\"default\",\"ModifyIndex\":20}]");
        ReplicationState start = ReplicationState.empty().withBookmark("jobs", Bookmark.empty().with("ModifyIndex", 5L));

        stream(NomadStreams.JOBS, 0, false).sync(start, records::add, states::add);

        assertThat(states).hasSize(2);
        Bookmark afterFirstPage = states.get(0).bookmark("jobs");
        assertThat(afterFirstPage.getLong("ModifyIndex")).contains(5L);
        assertThat(afterFirstPage.get(Bookmark.PROGRESS_MARKERS)).isEqualTo(Map.of("ModifyIndex", 30L));

        Bookmark afterLastPage = states.get(1).bookmark("jobs");
        assertThat(afterLastPage.getLong("ModifyIndex")).contains(30L);
        assertThat(afterLastPage.get(Bookmark.PROGRESS_MARKERS)).isNull();
        assertThat(records).hasSize(3);
    }

    @Test
    void sortedSourceAdvancesTheBookmarkAfterEveryPage() {
        api.page("/v1/events", "[{\"ID\":\"a\",\"ModifyIndex\":1},{\"ID\":\"b\",\"ModifyIndex\":2}]")
                .page("/v1/events", "[{\"ID\":\"c\",\"ModifyIndex\":3}]")
                .page("/v1/events", "[{\"ID\":\"d\",\"ModifyIndex\":5}]");

        stream(SORTED_EVENTS, 0, false).sync(ReplicationState.empty(), records::add, states::add);

        assertThat(states).extracting(s -> s.bookmark("events").getLong("ModifyIndex").orElseThrow())
                .containsExactly(2L, 3L, 5L)
                .isSorted();
    }

    @Test
    void statesAreEmittedAfterTheRecordsTheyCover() {
        List<String> events = new ArrayList<>();
        api.page("/v1/events", "[{\"ID\":\"a\",\"ModifyIndex\":1}]")
                .page("/v1/events", "[{\"ID\":\"b\",\"ModifyIndex\":2}]");

        stream(SORTED_EVENTS, 0, false).sync(ReplicationState.empty(),
                r -> events.add("RECORD " + r.values().get("ID")),
                s -> events.add("STATE " + s.bookmark("events").get("ModifyIndex")));

        assertThat(events).containsExactly("RECORD a", "STATE 1", "RECORD b", "STATE 2");
    }

    @Test
    void malformedPageEmitsNothingAndLeavesEarlierCommitsInPlace() {
        api.page("/v1/events", "[{\"ID\":\"a\",\"ModifyIndex\":1}]")
                .page("/v1/events", "[{\"ID\":\"b\",\"ModifyIndex\":2}, 42]");

        assertThatThrownBy(() -> stream(SORTED_EVENTS, 0, false).sync(ReplicationState.empty(), records::add, states::add))
                .isInstanceOf(MalformedRecordException.class);

        assertThat(records).extracting(r -> r.values().get("ID")).containsExactly("a");
        assertThat(states).hasSize(1);
        assertThat(states.get(0).bookmark("events").getLong("ModifyIndex")).contains(1L);
    }

    @Test
    void missingReplicationKeyIsMalformed() {
        api.page("/v1/events", "[{\"ID\":\"a\"}]");

        assertThatThrownBy(() -> stream(SORTED_EVENTS, 0, false).sync(ReplicationState.empty(), records::add, states::add))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("replication key");
    }

    @Test
    void serverSideFilterIsSentWhenEnabled() {
        api.page("/v1/deployments", "[]");
        ReplicationState start = ReplicationState.empty()
                .withBookmark("deployments", Bookmark.empty().with("ModifyIndex", 10L));

        stream(NomadStreams.DEPLOYMENTS, 0, true).sync(start, records::add, states::add);

        assertThat(api.requests("/v1/deployments").get(0).params()).containsEntry("filter", "ModifyIndex > 10");
    }

    @Test
    void noFilterIsSentByDefault() {
        api.page("/v1/deployments", "[]");

        stream(NomadStreams.DEPLOYMENTS, 3, false).sync(ReplicationState.empty(), records::add, states::add);

        assertThat(api.requests("/v1/deployments").get(0).params()).isEmpty();
    }

    @Test
    void leftoverProgressMarkersAreIgnoredOnResume() {
        api.page("/v1/deployments", "[{\"ID\":\"d1\",\"ModifyIndex\":12}]");
        Bookmark crashed = Bookmark.empty()
                .with("ModifyIndex", 10L)
                .with(Bookmark.PROGRESS_MARKERS, Map.of("ModifyIndex", 50L));

        ReplicationState result = stream(NomadStreams.DEPLOYMENTS, 0, false)
                .sync(ReplicationState.empty().withBookmark("deployments", crashed), records::add, states::add);

        assertThat(records).hasSize(1);
        assertThat(result.bookmark("deployments").asMap()).isEqualTo(Map.of("ModifyIndex", 12L));
    }

    private IncrementalStream stream(StreamDefinition definition, long startIndex, boolean serverSideFilter) {
        return new IncrementalStream(CatalogEntry.discovered(definition), api, mapper, clock, startIndex, serverSideFilter);
    }
}
