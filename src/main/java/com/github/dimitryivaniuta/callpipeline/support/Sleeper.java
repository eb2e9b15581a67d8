package com.github.dimitryivaniuta.callpipeline.support;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> {
        long ms = d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };

    void sleep(Duration duration) throws InterruptedException;
}
