package com.telcobright.coherence.api;

import lombok.Getter;

import java.time.Instant;

/**
 * Snapshot of a change feed connection.
 */
@Getter
public class ConnectionStatus {

    private final String table;
    private final ConnectionState state;
    private final DisconnectReason reason;
    private final String lastError;
    private final int reconnectAttempts;
    private final Instant connectedSince;
    private final Instant updatedAt;

    public ConnectionStatus(String table, ConnectionState state, DisconnectReason reason, String lastError,
                            int reconnectAttempts, Instant connectedSince, Instant updatedAt) {
        this.table = table;
        this.state = state;
        this.reason = reason;
        this.lastError = lastError;
        this.reconnectAttempts = reconnectAttempts;
        this.connectedSince = connectedSince;
        this.updatedAt = updatedAt;
    }

    public static ConnectionStatus initial(String table, Instant now) {
        return new ConnectionStatus(table, ConnectionState.DISCONNECTED, DisconnectReason.NONE, null, 0, null, now);
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    @Override
    public String toString() {
        return String.format("ConnectionStatus{table=%s, state=%s, reason=%s, attempts=%d, lastError=%s}",
            table, state, reason, reconnectAttempts, lastError);
    }
}
