package com.example.rentalchat.delivery;

/**
 * One connected live-channel client. Implementations wrap the transport connection.
 */
public interface LiveSession {

    String getSessionId();

    /**
     * Authenticated user that owns this session.
     */
    String getUserId();

    boolean isConnected();

    void send(LiveEvent event);
}
