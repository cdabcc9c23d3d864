package com.deskhub.inbox.conversation.api;

import com.deskhub.inbox.conversation.repo.ConversationMessageRepository;

public record ConversationMessageItem(
        String id,
        String conversation_id,
        String user_id,
        String customer_id,
        String content,
        boolean internal,
        long created_at
) {

    public static ConversationMessageItem from(ConversationMessageRepository.MessageRow row) {
        return new ConversationMessageItem(
                row.id(),
                row.conversationId(),
                row.userId(),
                row.customerId(),
                row.content(),
                row.internal(),
                row.createdAt().toEpochMilli()
        );
    }
}
