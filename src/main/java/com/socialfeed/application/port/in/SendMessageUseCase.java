package com.socialfeed.application.port.in;

import com.socialfeed.domain.error.MessagingError;
import com.socialfeed.domain.model.Message;
import com.socialfeed.domain.model.Result;
import com.socialfeed.domain.model.UserId;

public interface SendMessageUseCase {
    Result<Message, MessagingError> sendMessage(UserId senderId, UserId recipientId, String body);
}
