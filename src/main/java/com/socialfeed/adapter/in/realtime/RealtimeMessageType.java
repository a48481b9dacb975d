package com.socialfeed.adapter.in.realtime;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Message types carried on the realtime channels, by wire name. Some producers use older names,
 * which resolve to the same type.
 */
public enum RealtimeMessageType {
    NEW_POST("new_post", "post_created"),
    LIKE_UPDATE("like_update", "like_count_changed"),
    MESSAGE_SENT("message_sent"),
    MESSAGE_STATUS_UPDATED("message_status_updated"),
    AVATAR_CHANGED("avatar_changed", "avatar_updated"),
    INTERACTION("interaction", "user_interaction"),
    NOTIFICATION("notification"),
    NOTIFICATION_READ("notification_read");

    private final String wireName;
    private final List<String> aliases;

    RealtimeMessageType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public List<String> aliases() {
        return aliases;
    }

    public static Optional<RealtimeMessageType> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(t -> t.wireName.equals(name) || t.aliases.contains(name))
            .findFirst();
    }
}
