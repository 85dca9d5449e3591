package com.telcobright.coherence.cache;

import java.time.Duration;

/**
 * Component holding in-flight work that must settle before its cache shuts down.
 */
public interface Drainable {

    /**
     * @return true when everything settled within the timeout
     */
    boolean drain(Duration timeout);
}
