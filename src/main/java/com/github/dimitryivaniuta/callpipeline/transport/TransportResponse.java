package com.github.dimitryivaniuta.callpipeline.transport;

/**
 * Raw HTTP outcome; non-2xx statuses are returned, not thrown.
 */
public record TransportResponse(int status, String body) {

    public TransportResponse {
        body = (body == null) ? "" : body;
    }

    public boolean isServerError() {
        return status >= 500;
    }
}
