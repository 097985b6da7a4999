package com.indiaforecast.common.exception;

import com.indiaforecast.common.model.SourceId;

/** Network failure or timeout that persisted through every retry. */
public class SourceUnavailableException extends SourceFetchException {

    public SourceUnavailableException(SourceId source, String message) {
        super(source, message);
    }

    public SourceUnavailableException(SourceId source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
