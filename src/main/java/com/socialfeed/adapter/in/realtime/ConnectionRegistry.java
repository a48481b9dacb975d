package com.socialfeed.adapter.in.realtime;

/**
 * Live client connections grouped into rooms. Every user's connections share the room named by their user id.
 */
public interface ConnectionRegistry {

    void emitToRoom(String room, String event, Object payload);

    void emitGlobal(String event, Object payload);

    void join(String room, String connectionId);

    /**
     * Removes the connection from every room it joined.
     */
    void leave(String connectionId);
}
