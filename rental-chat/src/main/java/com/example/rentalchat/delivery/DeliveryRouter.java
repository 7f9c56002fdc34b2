package com.example.rentalchat.delivery;

import com.example.rentalchat.domain.RoomKey;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-local room membership and best-effort fan-out of live events. Nothing is queued for sessions
 * that are not joined; clients catch up through the message listing after reconnecting.
 */
@Slf4j
@Component
public class DeliveryRouter {

    private final Map<RoomKey, Set<LiveSession>> rooms = new ConcurrentHashMap<>();
    private final Map<String, Set<RoomKey>> roomsBySession = new ConcurrentHashMap<>();

    public void join(LiveSession session, RoomKey roomKey) {
        rooms.compute(roomKey, (key, members) -> withMember(members, session));
        roomsBySession.compute(session.getSessionId(), (id, keys) -> withMember(keys, roomKey));
        log.debug("Session {} of user {} joined {}", session.getSessionId(), session.getUserId(), roomKey);
    }

    public void leave(LiveSession session, RoomKey roomKey) {
        removeMember(roomKey, session);
        roomsBySession.computeIfPresent(session.getSessionId(), (id, keys) -> {
            keys.remove(roomKey);
            return keys.isEmpty() ? null : keys;
        });
        log.debug("Session {} left {}", session.getSessionId(), roomKey);
    }

    /**
     * Drops the session from every room it joined. Called on disconnect.
     */
    public void leaveAll(LiveSession session) {
        Set<RoomKey> joined = roomsBySession.remove(session.getSessionId());
        if (joined == null) {
            return;
        }
        joined.forEach(roomKey -> removeMember(roomKey, session));
        log.debug("Session {} removed from {} rooms", session.getSessionId(), joined.size());
    }

    public Set<LiveSession> members(RoomKey roomKey) {
        Set<LiveSession> members = rooms.get(roomKey);
        return members == null ? Set.of() : Collections.unmodifiableSet(members);
    }

    public Set<RoomKey> roomsOf(LiveSession session) {
        Set<RoomKey> joined = roomsBySession.get(session.getSessionId());
        return joined == null ? Set.of() : Collections.unmodifiableSet(joined);
    }

    public int broadcast(RoomKey roomKey, LiveEvent event) {
        return broadcast(roomKey, event, null);
    }

    /**
     * Delivers the event to every session currently in the room except {@code excludeSessionId}.
     * Failures on individual sessions are logged and skipped.
     *
     * @return number of sessions the event was handed to
     */
    public int broadcast(RoomKey roomKey, LiveEvent event, String excludeSessionId) {
        Set<LiveSession> members = rooms.get(roomKey);
        if (members == null || members.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (LiveSession session : members) {
            if (session.getSessionId().equals(excludeSessionId)) {
                continue;
            }
            if (!session.isConnected()) {
                leaveAll(session);
                continue;
            }
            try {
                session.send(event);
                delivered++;
            } catch (RuntimeException ex) {
                log.warn("Failed to deliver {} to session {} in {}", event.name(), session.getSessionId(), roomKey, ex);
            }
        }
        log.debug("Delivered {} to {} sessions in {}", event.name(), delivered, roomKey);
        return delivered;
    }

    // add inside compute so a concurrent leave cannot drop the set between creation and insertion
    private static <T> Set<T> withMember(Set<T> members, T member) {
        Set<T> result = members != null ? members : ConcurrentHashMap.newKeySet();
        result.add(member);
        return result;
    }

    private void removeMember(RoomKey roomKey, LiveSession session) {
        rooms.computeIfPresent(roomKey, (key, members) -> {
            members.remove(session);
            return members.isEmpty() ? null : members;
        });
    }
}
