package com.nomadtap.tap.error;

import lombok.Getter;

@Getter
public class MalformedRecordException extends TapException {

    private final String streamName;

    public MalformedRecordException(String streamName, String message) {
        super("Malformed record in stream " + streamName + ": " + message);
        this.streamName = streamName;
    }
}
