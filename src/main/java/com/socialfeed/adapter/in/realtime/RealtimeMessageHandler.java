package com.socialfeed.adapter.in.realtime;

/**
 * Fans one realtime message type out to the connected clients.
 */
public interface RealtimeMessageHandler {

    RealtimeMessageType type();

    void handle(ConnectionRegistry connections, RealtimeMessage message, String channel);
}
