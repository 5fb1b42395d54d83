package com.example.autopilot.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Makes the approval console see the same JSON as the REST API: ISO instants and tolerant reads.
 */
public class SocketIoJsonSupport extends JacksonJsonSupport {

    public SocketIoJsonSupport(ObjectMapper applicationMapper) {
        super(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.setTimeZone(applicationMapper.getSerializationConfig().getTimeZone());
    }
}
