package com.deskhub.inbox.conversation.api;

import java.util.List;

public record ConversationDetailResponse(
        ConversationItem conversation,
        List<String> tag_ids,
        List<String> participated_user_ids
) {
}
