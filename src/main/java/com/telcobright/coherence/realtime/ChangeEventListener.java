package com.telcobright.coherence.realtime;

import com.telcobright.coherence.remote.ChangeEvent;

/**
 * Called after each change event has been reconciled.
 */
@FunctionalInterface
public interface ChangeEventListener {

    void onEvent(ChangeEvent event, ReconcileOutcome outcome);
}
