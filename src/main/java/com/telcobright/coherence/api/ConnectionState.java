package com.telcobright.coherence.api;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
