package com.example.rentalchat.controller;

import com.example.rentalchat.client.UserSummary;
import com.example.rentalchat.config.ChatModuleConfig;
import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.MessageType;
import com.example.rentalchat.dto.ConversationView;
import com.example.rentalchat.service.ConversationService;
import com.example.rentalchat.service.ParticipantIdentityService;
import com.example.rentalchat.service.exception.AuthorizationException;
import com.example.rentalchat.service.exception.TransientStoreException;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConversationController.class)
@Import({ChatModuleConfig.class, ParticipantIdentityService.class})
class ConversationControllerTest {

    private static final String USER_HEADER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    private ConversationView view(String id) {
        return ConversationView.builder()
                .id(id)
                .participants(List.of(UserSummary.idOnly("tenant"), UserSummary.idOnly("owner")))
                .unreadCount(2)
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .updatedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }

    @Test
    void startConversation_shouldUseCallerAsInitiator() throws Exception {
        when(conversationService.startConversation("tenant", "owner", "listing-7")).thenReturn(view("conv-1"));

        mockMvc.perform(post("/api/chat/conversations")
                        .header(USER_HEADER, "tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"owner\",\"listingId\":\"listing-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("conv-1"))
                .andExpect(jsonPath("$.unreadCount").value(2))
                .andExpect(jsonPath("$.participants[1].id").value("owner"));
    }

    @Test
    void startConversation_withoutUserHeaderShouldBeUnauthorized() throws Exception {
        mockMvc.perform(post("/api/chat/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"owner\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthenticated"));

        verify(conversationService, never()).startConversation(any(), any(), any());
    }

    @Test
    void startConversation_blankRecipientShouldFailValidation() throws Exception {
        mockMvc.perform(post("/api/chat/conversations")
                        .header(USER_HEADER, "tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.details.recipientId").exists());
    }

    @Test
    void startConversation_unknownFieldShouldBeRejected() throws Exception {
        mockMvc.perform(post("/api/chat/conversations")
                        .header(USER_HEADER, "tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"owner\",\"propertyOwner\":{\"name\":\"x\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));

        verify(conversationService, never()).startConversation(any(), any(), any());
    }

    @Test
    void listConversations_shouldPassLimit() throws Exception {
        when(conversationService.getConversationsWithUnread("tenant", 20))
                .thenReturn(List.of(view("conv-1"), view("conv-2")));

        mockMvc.perform(get("/api/chat/conversations")
                        .header(USER_HEADER, "tenant")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].id").value("conv-2"));
    }

    @Test
    void getConversation_nonParticipantShouldBeForbidden() throws Exception {
        when(conversationService.getConversation("conv-1", "stranger"))
                .thenThrow(new AuthorizationException("User is not a participant of this conversation"));

        mockMvc.perform(get("/api/chat/conversations/conv-1").header(USER_HEADER, "stranger"))
                .andExpect(status().isForbidden())
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(jsonPath("$.code").value("not_a_participant"));
    }

    @Test
    void getMessages_shouldForwardCursorAndLimit() throws Exception {
        ChatMessage message = ChatMessage.builder()
                .id("m-2")
                .sequence(12)
                .conversationId("conv-1")
                .type(MessageType.TEXT)
                .senderId("owner")
                .content("Yes, still available")
                .readBy(Set.of("owner"))
                .createdAt(Instant.parse("2024-05-01T10:05:00Z"))
                .build();
        when(conversationService.listMessages("conv-1", "tenant", 11L, 50)).thenReturn(List.of(message));

        mockMvc.perform(get("/api/chat/conversations/conv-1/messages")
                        .header(USER_HEADER, "tenant")
                        .param("after", "11")
                        .param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sequence").value(12))
                .andExpect(jsonPath("$[0].content").value("Yes, still available"))
                .andExpect(jsonPath("$[0].createdAt").value("2024-05-01T10:05:00Z"));
    }

    @Test
    void getMessages_malformedCursorShouldBeBadRequest() throws Exception {
        mockMvc.perform(get("/api/chat/conversations/conv-1/messages")
                        .header(USER_HEADER, "tenant")
                        .param("after", "latest"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void postMessage_storeOutageShouldBeServiceUnavailable() throws Exception {
        when(conversationService.sendMessage("conv-1", "tenant", "hello"))
                .thenThrow(new TransientStoreException("Store operation 'append' failed", null));

        mockMvc.perform(post("/api/chat/conversations/conv-1/messages")
                        .header(USER_HEADER, "tenant")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"hello\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.code").value("store_unavailable"));
    }

    @Test
    void markRead_shouldReturnMarkedCount() throws Exception {
        when(conversationService.markRead("conv-1", "tenant")).thenReturn(3);

        mockMvc.perform(post("/api/chat/conversations/conv-1/read").header(USER_HEADER, "tenant"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("conv-1"))
                .andExpect(jsonPath("$.markedCount").value(3));
    }
}
