package com.telcobright.coherence.remote;

/**
 * Failure reported by a {@link RemoteStore} call.
 */
public class RemoteStoreException extends CoherenceException {

    public RemoteStoreException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public RemoteStoreException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }

    public static RemoteStoreException notFound(String entityType, String id) {
        return new RemoteStoreException(ErrorKind.NOT_FOUND, entityType + " " + id + " not found");
    }

    public static RemoteStoreException validation(String message) {
        return new RemoteStoreException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static RemoteStoreException network(String message) {
        return new RemoteStoreException(ErrorKind.NETWORK_ERROR, message);
    }

    public static RemoteStoreException conflict(String message) {
        return new RemoteStoreException(ErrorKind.CONFLICT, message);
    }
}
