package com.example.rentalchat.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;

@Slf4j
@org.springframework.context.annotation.Configuration
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(ChatProperties chatProperties, ObjectMapper objectMapper) {
        ChatProperties.Socketio socketio = chatProperties.getSocketio();
        Configuration configuration = new Configuration();
        configuration.setHostname(socketio.getHost());
        configuration.setPort(socketio.getPort());
        configuration.setOrigin(socketio.getOrigin());
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SpringJacksonJsonSupport(objectMapper));

        server = new SocketIOServer(configuration);
        server.start();
        log.info("Socket.IO live channel listening on {}:{}", socketio.getHost(), socketio.getPort());
        return server;
    }

    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
        }
    }
}
