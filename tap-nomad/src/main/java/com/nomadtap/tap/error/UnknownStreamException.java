package com.nomadtap.tap.error;

import lombok.Getter;

@Getter
public class UnknownStreamException extends TapException {

    private final String streamName;

    public UnknownStreamException(String streamName) {
        super("Unknown stream: " + streamName);
        this.streamName = streamName;
    }
}
