package com.example.rentalchat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Acknowledgement returned for every inbound socket event that requests one.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SocketAck {
    boolean ok;
    String kind;
    String error;
    Object data;

    public static SocketAck success(Object data) {
        return SocketAck.builder().ok(true).data(data).build();
    }

    public static SocketAck failure(String kind, String error) {
        return SocketAck.builder().ok(false).kind(kind).error(error).build();
    }
}
