package com.example.rentalchat.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.rentalchat.config.ChatSecurityProperties;
import com.example.rentalchat.delivery.DeliveryRouter;
import com.example.rentalchat.delivery.LiveSession;
import com.example.rentalchat.domain.RoomKey;
import com.example.rentalchat.dto.ChatMessagePayload;
import com.example.rentalchat.dto.ConversationRoomPayload;
import com.example.rentalchat.dto.MarkReadResponse;
import com.example.rentalchat.dto.SocketAck;
import com.example.rentalchat.service.ConversationService;
import com.example.rentalchat.service.ParticipantIdentityService;
import com.example.rentalchat.service.exception.ServiceException;
import com.example.rentalchat.service.exception.UnauthenticatedException;
import com.example.rentalchat.service.exception.ValidationException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Socket.IO entry point of the live channel. Sending over the socket goes through the same
 * {@link ConversationService#sendMessage} path as the REST endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIoChatGateway {

    static final String JOIN_EVENT = "join";
    static final String LEAVE_EVENT = "leave";
    static final String SEND_MESSAGE_EVENT = "send-message";
    static final String MARK_READ_EVENT = "mark-read";
    static final String TYPING_START_EVENT = "typing-start";
    static final String TYPING_STOP_EVENT = "typing-stop";
    static final String READY_EVENT = "system:ready";
    static final String ERROR_EVENT = "system:error";
    static final String SESSION_ATTRIBUTE = "liveSession";

    private static final String PARAM_USER_ID = "userId";

    private final SocketIOServer socketIOServer;
    private final DeliveryRouter deliveryRouter;
    private final ConversationService conversationService;
    private final ParticipantIdentityService identityService;
    private final ChatSecurityProperties securityProperties;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(JOIN_EVENT, ConversationRoomPayload.class, this::handleJoin);
        socketIOServer.addEventListener(LEAVE_EVENT, ConversationRoomPayload.class, this::handleLeave);
        socketIOServer.addEventListener(SEND_MESSAGE_EVENT, ChatMessagePayload.class, this::handleSendMessage);
        socketIOServer.addEventListener(MARK_READ_EVENT, ConversationRoomPayload.class, this::handleMarkRead);
        socketIOServer.addEventListener(TYPING_START_EVENT, ConversationRoomPayload.class, this::handleTypingStart);
        socketIOServer.addEventListener(TYPING_STOP_EVENT, ConversationRoomPayload.class, this::handleTypingStop);
    }

    void handleConnect(SocketIOClient client) {
        try {
            String userId = identityService.resolveUserId(
                    client.getHandshakeData().getSingleUrlParam(PARAM_USER_ID),
                    client.getHandshakeData().getHttpHeaders().get(securityProperties.getUserHeader()));
            SocketIoLiveSession session = new SocketIoLiveSession(client, userId);
            client.set(SESSION_ATTRIBUTE, session);
            deliveryRouter.join(session, RoomKey.user(userId));
            client.sendEvent(READY_EVENT, Map.of("userId", userId, "sessionId", session.getSessionId()));
            log.info("Client {} connected as user {}", client.getSessionId(), userId);
        } catch (Exception e) {
            log.warn("Rejected connection {}: {}", client.getSessionId(), e.getMessage());
            client.sendEvent(ERROR_EVENT, Map.of("message", String.valueOf(e.getMessage())));
            client.disconnect();
        }
    }

    void handleDisconnect(SocketIOClient client) {
        LiveSession session = client.get(SESSION_ATTRIBUTE);
        if (session == null) {
            return;
        }
        deliveryRouter.leaveAll(session);
        client.del(SESSION_ATTRIBUTE);
        log.info("Client {} of user {} disconnected", client.getSessionId(), session.getUserId());
    }

    void handleJoin(SocketIOClient client, ConversationRoomPayload payload, AckRequest ackRequest) {
        respond(client, ackRequest, JOIN_EVENT, session -> {
            String conversationId = conversationId(payload);
            conversationService.authorizeParticipant(conversationId, session.getUserId());
            RoomKey room = RoomKey.conversation(conversationId);
            deliveryRouter.join(session, room);
            return Map.of("roomKey", room.toString());
        });
    }

    void handleLeave(SocketIOClient client, ConversationRoomPayload payload, AckRequest ackRequest) {
        respond(client, ackRequest, LEAVE_EVENT, session -> {
            RoomKey room = RoomKey.conversation(conversationId(payload));
            deliveryRouter.leave(session, room);
            return Map.of("roomKey", room.toString());
        });
    }

    void handleSendMessage(SocketIOClient client, ChatMessagePayload payload, AckRequest ackRequest) {
        respond(client, ackRequest, SEND_MESSAGE_EVENT, session -> conversationService.sendMessage(
                payload != null ? payload.getConversationId() : null,
                session.getUserId(),
                payload != null ? payload.getContent() : null));
    }

    void handleMarkRead(SocketIOClient client, ConversationRoomPayload payload, AckRequest ackRequest) {
        respond(client, ackRequest, MARK_READ_EVENT, session -> {
            String conversationId = conversationId(payload);
            int marked = conversationService.markRead(conversationId, session.getUserId());
            return new MarkReadResponse(conversationId, marked);
        });
    }

    void handleTypingStart(SocketIOClient client, ConversationRoomPayload payload, AckRequest ackRequest) {
        respond(client, ackRequest, TYPING_START_EVENT, session -> {
            conversationService.typing(conversationId(payload), session.getUserId(), true, session.getSessionId());
            return null;
        });
    }

    void handleTypingStop(SocketIOClient client, ConversationRoomPayload payload, AckRequest ackRequest) {
        respond(client, ackRequest, TYPING_STOP_EVENT, session -> {
            conversationService.typing(conversationId(payload), session.getUserId(), false, session.getSessionId());
            return null;
        });
    }

    private void respond(
            SocketIOClient client, AckRequest ackRequest, String event, Function<LiveSession, Object> action) {
        LiveSession session = client.get(SESSION_ATTRIBUTE);
        try {
            if (session == null) {
                throw new UnauthenticatedException("Connection is not bound to a user");
            }
            acknowledge(ackRequest, SocketAck.success(action.apply(session)));
        } catch (ServiceException ex) {
            log.debug("Rejected {} from {}: {}", event, client.getSessionId(), ex.getMessage());
            acknowledge(ackRequest, SocketAck.failure(ex.getErrorCode(), ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Failed to handle {} from {}", event, client.getSessionId(), ex);
            acknowledge(ackRequest, SocketAck.failure("internal_error", "Unexpected error"));
        }
    }

    private void acknowledge(AckRequest ackRequest, SocketAck ack) {
        if (ackRequest != null && ackRequest.isAckRequested()) {
            ackRequest.sendAckData(ack);
        }
    }

    private String conversationId(ConversationRoomPayload payload) {
        String conversationId = payload != null ? payload.getConversationId() : null;
        if (!StringUtils.hasText(conversationId)) {
            throw new ValidationException("Conversation id is required");
        }
        return conversationId;
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(JOIN_EVENT);
        socketIOServer.removeAllListeners(LEAVE_EVENT);
        socketIOServer.removeAllListeners(SEND_MESSAGE_EVENT);
        socketIOServer.removeAllListeners(MARK_READ_EVENT);
        socketIOServer.removeAllListeners(TYPING_START_EVENT);
        socketIOServer.removeAllListeners(TYPING_STOP_EVENT);
    }
}
