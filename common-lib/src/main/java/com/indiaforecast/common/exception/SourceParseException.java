package com.indiaforecast.common.exception;

import com.indiaforecast.common.model.SourceId;

/** Malformed response. Permanent for that response, so it is never retried. */
public class SourceParseException extends SourceFetchException {

    public SourceParseException(SourceId source, String message) {
        super(source, message);
    }

    public SourceParseException(SourceId source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
