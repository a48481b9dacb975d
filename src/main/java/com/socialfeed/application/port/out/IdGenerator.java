package com.socialfeed.application.port.out;

import java.util.UUID;

/**
 * Source of time-ordered identifiers for content, messages, notifications and events.
 */
public interface IdGenerator {

    UUID generate();

    /**
     * Milliseconds since epoch encoded in a time-based id.
     */
    long extractTimestamp(UUID id);
}
