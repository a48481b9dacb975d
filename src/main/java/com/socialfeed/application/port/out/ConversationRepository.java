package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.Conversation;
import com.socialfeed.domain.model.UserId;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

public interface ConversationRepository {
    Optional<Conversation> findById(String conversationId);

    /**
     * Inserts the conversation unless one with the same participant hash exists, then returns the stored one.
     */
    Conversation findOrCreate(Conversation conversation);

    void touch(String conversationId, Instant lastMessageAt);

    void incrementUnread(String conversationId, Collection<UserId> participants);

    void resetUnread(String conversationId, UserId participant);

    int getUnread(String conversationId, UserId participant);
}
