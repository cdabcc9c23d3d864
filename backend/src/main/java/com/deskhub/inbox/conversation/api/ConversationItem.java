package com.deskhub.inbox.conversation.api;

import com.deskhub.inbox.conversation.repo.ConversationRepository;

public record ConversationItem(
        String id,
        String integration_id,
        String customer_id,
        String user_id,
        String assigned_user_id,
        String status,
        String content,
        int message_count,
        long created_at,
        long updated_at
) {

    public static ConversationItem from(ConversationRepository.ConversationRow row) {
        return new ConversationItem(
                row.id(),
                row.integrationId(),
                row.customerId(),
                row.userId(),
                row.assignedUserId(),
                row.status(),
                row.content(),
                row.messageCount(),
                row.createdAt().getEpochSecond(),
                row.updatedAt().getEpochSecond()
        );
    }
}
