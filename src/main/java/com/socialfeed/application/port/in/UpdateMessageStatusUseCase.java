package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.MessagingError;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

/**
 * Receipts only move forward; both operations return how many receipts actually advanced.
 */
public interface UpdateMessageStatusUseCase {
    Result<Integer, MessagingError> markConversationDelivered(UserId userId, String conversationId);

    Result<Integer, MessagingError> markConversationRead(UserId userId, String conversationId);
}
