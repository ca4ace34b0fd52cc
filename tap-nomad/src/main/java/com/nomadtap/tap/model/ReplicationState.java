package com.nomadtap.tap.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stream name to bookmark. Immutable: every commit produces a new snapshot, so a STATE message
 * that has been handed to the writer can never change afterwards.
 */
public final class ReplicationState {

    private static final ReplicationState EMPTY = new ReplicationState(Map.of());

    private final Map<String, Bookmark> bookmarks;

    private ReplicationState(Map<String, Bookmark> bookmarks) {
        this.bookmarks = Collections.unmodifiableMap(new LinkedHashMap<>(bookmarks));
    }

    public static ReplicationState empty() {
        return EMPTY;
    }

    public static ReplicationState of(Map<String, Bookmark> bookmarks) {
        return bookmarks == null || bookmarks.isEmpty() ? EMPTY : new ReplicationState(bookmarks);
    }

    public Bookmark bookmark(String stream) {
        return bookmarks.getOrDefault(stream, Bookmark.empty());
    }

    public ReplicationState withBookmark(String stream, Bookmark bookmark) {
        Map<String, Bookmark> copy = new LinkedHashMap<>(bookmarks);
        copy.put(stream, bookmark);
        return new ReplicationState(copy);
    }

    public Map<String, Bookmark> bookmarks() {
        return bookmarks;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReplicationState other && bookmarks.equals(other.bookmarks);
    }

    @Override
    public int hashCode() {
        return bookmarks.hashCode();
    }

    @Override
    public String toString() {
        return "ReplicationState" + bookmarks;
    }
}
