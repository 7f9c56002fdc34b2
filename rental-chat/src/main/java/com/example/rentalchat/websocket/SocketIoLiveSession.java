package com.example.rentalchat.websocket;

import com.corundumstudio.socketio.SocketIOClient;
import com.example.rentalchat.delivery.LiveEvent;
import com.example.rentalchat.delivery.LiveSession;

/**
 * {@link LiveSession} over a Socket.IO client connection. One instance per connection.
 */
class SocketIoLiveSession implements LiveSession {

    private final SocketIOClient client;
    private final String userId;

    SocketIoLiveSession(SocketIOClient client, String userId) {
        this.client = client;
        this.userId = userId;
    }

    @Override
    public String getSessionId() {
        return client.getSessionId().toString();
    }

    @Override
    public String getUserId() {
        return userId;
    }

    @Override
    public boolean isConnected() {
        return client.isChannelOpen();
    }

    @Override
    public void send(LiveEvent event) {
        client.sendEvent(event.name(), event.payload());
    }
}
