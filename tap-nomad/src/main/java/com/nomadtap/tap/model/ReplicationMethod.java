package com.nomadtap.tap.model;

public enum ReplicationMethod {
    FULL_TABLE,  // re-read the whole collection on every run
    INCREMENTAL  // read only rows past the bookmark
}
