package com.example.autopilot.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@Slf4j
@org.springframework.context.annotation.Configuration
@ConditionalOnProperty(name = "autopilot.socketio.enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(
            @Value("${autopilot.socketio.host:0.0.0.0}") String host,
            @Value("${autopilot.socketio.port:9094}") int port,
            @Value("${autopilot.socketio.origin:*}") String origin,
            ObjectMapper objectMapper) {
        Configuration configuration = new Configuration();
        configuration.setHostname(host);
        configuration.setPort(port);
        configuration.setOrigin(origin);
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SocketIoJsonSupport(objectMapper));

        server = new SocketIOServer(configuration);
        server.start();
        log.info("Approval console socket listening on {}:{}", host, port);
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
        }
    }
}
