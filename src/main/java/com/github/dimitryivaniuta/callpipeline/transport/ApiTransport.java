package com.github.dimitryivaniuta.callpipeline.transport;

import java.net.URI;

public interface ApiTransport {

    /**
     * POSTs {@code jsonBody} to {@code uri}.
     *
     * @throws TransportException when no response was received at all
     */
    TransportResponse post(URI uri, String jsonBody) throws TransportException;
}
