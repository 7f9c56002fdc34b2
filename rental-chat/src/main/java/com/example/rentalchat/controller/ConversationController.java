package com.example.rentalchat.controller;

import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.dto.ConversationView;
import com.example.rentalchat.dto.MarkReadResponse;
import com.example.rentalchat.dto.SendMessageRequest;
import com.example.rentalchat.dto.StartConversationRequest;
import com.example.rentalchat.service.ConversationService;
import com.example.rentalchat.service.ParticipantIdentityService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/chat/conversations")
public class ConversationController {

    static final String USER_HEADER = "X-User-Id";

    private final ConversationService conversationService;
    private final ParticipantIdentityService participantIdentityService;

    public ConversationController(
            ConversationService conversationService,
            ParticipantIdentityService participantIdentityService) {
        this.conversationService = conversationService;
        this.participantIdentityService = participantIdentityService;
    }

    @PostMapping
    public ResponseEntity<ConversationView> startConversation(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @Valid @RequestBody StartConversationRequest request) {
        String initiatorId = participantIdentityService.resolveUserId(userId);
        return ResponseEntity.ok(conversationService.startConversation(
                initiatorId, request.getRecipientId(), request.getListingId()));
    }

    @GetMapping
    public ResponseEntity<List<ConversationView>> listConversations(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @RequestParam(required = false) Integer limit) {
        String caller = participantIdentityService.resolveUserId(userId);
        return ResponseEntity.ok(conversationService.getConversationsWithUnread(caller, limit));
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<ConversationView> getConversation(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @PathVariable String conversationId) {
        String caller = participantIdentityService.resolveUserId(userId);
        return ResponseEntity.ok(conversationService.getConversation(conversationId, caller));
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<List<ChatMessage>> getMessages(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @PathVariable String conversationId,
            @RequestParam(name = "after", required = false) Long afterSequence,
            @RequestParam(required = false) Integer limit) {
        String caller = participantIdentityService.resolveUserId(userId);
        return ResponseEntity.ok(conversationService.listMessages(conversationId, caller, afterSequence, limit));
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<ChatMessage> postMessage(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @PathVariable String conversationId,
            @Valid @RequestBody SendMessageRequest request) {
        String senderId = participantIdentityService.resolveUserId(userId);
        return ResponseEntity.ok(conversationService.sendMessage(conversationId, senderId, request.getContent()));
    }

    @PostMapping("/{conversationId}/read")
    public ResponseEntity<MarkReadResponse> markRead(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @PathVariable String conversationId) {
        String caller = participantIdentityService.resolveUserId(userId);
        int marked = conversationService.markRead(conversationId, caller);
        return ResponseEntity.ok(new MarkReadResponse(conversationId, marked));
    }
}
