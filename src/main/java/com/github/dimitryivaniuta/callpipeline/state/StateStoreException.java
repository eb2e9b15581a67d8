package com.github.dimitryivaniuta.callpipeline.state;

import java.nio.file.Path;

/**
 * A state file could not be read, locked or written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(Path path, String action, Throwable cause) {
        super("State file " + action + " failed: " + path, cause);
    }
}
