package com.socialfeed.domain.model;

public enum NotificationAction {
    LIKE,
    COMMENT,
    FOLLOW,
    MESSAGE,
    MENTION
}
