package com.github.dimitryivaniuta.callpipeline.transport;

/**
 * Connect, DNS, TLS or I/O failure: no HTTP response was received.
 */
public class TransportException extends Exception {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
