package com.example.rentalchat.dto;

public record MarkReadResponse(String conversationId, int markedCount) {}
