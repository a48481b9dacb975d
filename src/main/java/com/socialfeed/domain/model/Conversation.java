package com.socialfeed.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A conversation is identified by the hash of its sorted participant ids, so a pair of users
 * can only ever share one 1:1 conversation.
 */
public record Conversation(
    String id,
    List<UserId> participants,
    Instant lastMessageAt
) {
    public Conversation {
        participants = List.copyOf(participants);
    }

    public static Conversation start(List<UserId> participants) {
        List<UserId> sorted = participants.stream().distinct().sorted().toList();
        return new Conversation(participantHash(sorted), sorted, Instant.now());
    }

    public static String participantHash(List<UserId> participants) {
        return participants.stream()
            .map(UserId::toString)
            .distinct()
            .sorted()
            .collect(Collectors.joining(":"));
    }

    public boolean hasParticipant(UserId userId) {
        return participants.contains(userId);
    }

    public List<UserId> recipientsOf(UserId senderId) {
        return participants.stream()
            .filter(p -> !p.equals(senderId))
            .toList();
    }
}
