package com.indiaforecast.common.exception;

import com.indiaforecast.common.model.SourceId;

/**
 * Base type for the two failures a source fetcher may raise. Never escapes the
 * fetch orchestrator.
 */
public abstract class SourceFetchException extends RuntimeException {
    private final SourceId source;

    protected SourceFetchException(SourceId source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    protected SourceFetchException(SourceId source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public SourceId getSource() {
        return source;
    }
}
