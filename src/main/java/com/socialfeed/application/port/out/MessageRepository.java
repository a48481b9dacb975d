package com.socialfeed.application.port.out;

import com.socialfeed.domain.model.DeliveryStatus;
import com.socialfeed.domain.model.Message;
import com.socialfeed.domain.model.UserId;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface MessageRepository {

    /**
     * Stores the message and one receipt in state SENT per recipient.
     */
    void save(Message message, Collection<UserId> recipients);

    /**
     * Moves every receipt of {@code recipient} in the conversation that is behind {@code target} to {@code target}.
     * Receipts already at or past {@code target} are left alone. Returns the number of receipts advanced.
     */
    int advanceReceipts(String conversationId, UserId recipient, DeliveryStatus target);

    Optional<DeliveryStatus> findReceiptStatus(UUID messageId, UserId recipient);
}
