package com.example.rentalchat.domain;

public enum MessageType {
    TEXT,
    SYSTEM
}
