package com.p14n.pubsub.data;

/**
 * Result of a bridge operation as seen by the caller. Failures are carried as
 * a message rather than thrown.
 *
 * @param success whether the operation succeeded
 * @param message human readable failure reason, empty on success
 * @param data    operation specific payload, {@code null} on failure
 * @param <T>     payload type
 */
public record BridgeResponse<T>(boolean success, String message, T data) {

    public static <T> BridgeResponse<T> ok(T data) {
        return new BridgeResponse<>(true, "", data);
    }

    public static <T> BridgeResponse<T> ok() {
        return new BridgeResponse<>(true, "", null);
    }

    public static <T> BridgeResponse<T> failed(String message) {
        return new BridgeResponse<>(false, message == null ? "" : message, null);
    }
}
