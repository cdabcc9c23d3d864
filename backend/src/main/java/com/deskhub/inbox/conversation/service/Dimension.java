package com.deskhub.inbox.conversation.service;

/**
 * A part of the main query that an aggregation can take out and replace with its own per-value
 * predicate.
 */
public enum Dimension {
    CHANNEL,
    BRAND,
    INTEGRATION_TYPE,
    TAG,
    STATUS,
    UNASSIGNED,
    PARTICIPATING,
    STARRED
}
