package com.example.rentalchat.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Bridges Spring's configured {@link ObjectMapper} into Netty-SocketIO so live events serialize
 * {@code Instant} the same way as the REST responses and inbound socket payloads reject unknown fields.
 */
public class SpringJacksonJsonSupport extends JacksonJsonSupport {

    public SpringJacksonJsonSupport(ObjectMapper baseMapper) {
        super(new JavaTimeModule());

        if (!baseMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)) {
            this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
        this.objectMapper.configure(
                DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                baseMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        this.objectMapper.setTimeZone(baseMapper.getSerializationConfig().getTimeZone());
    }
}
