package com.github.dimitryivaniuta.callpipeline.testing;

import com.github.dimitryivaniuta.callpipeline.transport.ApiTransport;
import com.github.dimitryivaniuta.callpipeline.transport.TransportException;
import com.github.dimitryivaniuta.callpipeline.transport.TransportResponse;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays queued responses in order; the last one repeats once the queue runs dry.
 */
public class ScriptedTransport implements ApiTransport {

    public record Sent(URI uri, String body) {}

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<Sent> sent = new ArrayList<>();
    private Object last;

    public ScriptedTransport respond(int status, String body) {
        script.add(new TransportResponse(status, body));
        return this;
    }

    public ScriptedTransport failNetwork(String reason) {
        script.add(new TransportException(reason, new IOException(reason)));
        return this;
    }

    @Override
    public synchronized TransportResponse post(URI uri, String jsonBody) throws TransportException {
        sent.add(new Sent(uri, jsonBody));
        Object next = script.isEmpty() ? last : script.poll();
        if (next == null) throw new IllegalStateException("no scripted response left");
        last = next;
        if (next instanceof TransportException e) throw e;
        return (TransportResponse) next;
    }

    public synchronized List<Sent> sent() {
        return List.copyOf(sent);
    }

    public synchronized int calls() {
        return sent.size();
    }
}
