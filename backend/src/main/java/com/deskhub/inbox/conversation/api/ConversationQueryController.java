package com.deskhub.inbox.conversation.api;

import com.deskhub.inbox.auth.service.ViewerResolver;
import com.deskhub.inbox.common.api.ApiResponse;
import com.deskhub.inbox.conversation.service.ConversationListArgs;
import com.deskhub.inbox.conversation.service.ConversationQueryService;
import jakarta.validation.constraints.Min;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationQueryController {

    private final ConversationQueryService conversationQueryService;
    private final ViewerResolver viewerResolver;

    public ConversationQueryController(ConversationQueryService conversationQueryService, ViewerResolver viewerResolver) {
        this.conversationQueryService = conversationQueryService;
        this.viewerResolver = viewerResolver;
    }

    @GetMapping
    public ApiResponse<List<ConversationItem>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "channel_id", required = false) String channelId,
            @RequestParam(value = "brand_id", required = false) String brandId,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "integration_type", required = false) String integrationType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "starred", required = false) Boolean starred,
            @RequestParam(value = "participating", required = false) Boolean participating,
            @RequestParam(value = "unassigned", required = false) Boolean unassigned,
            @RequestParam(value = "search_value", required = false) String searchValue,
            @RequestParam(value = "limit", required = false, defaultValue = "0") @Min(0) int limit
    ) {
        var viewer = viewerResolver.resolve(authorization);
        var args = new ConversationListArgs(ids, channelId, brandId, tag, integrationType, status,
                Boolean.TRUE.equals(starred), Boolean.TRUE.equals(participating), Boolean.TRUE.equals(unassigned),
                searchValue, limit);
        return ApiResponse.ok(conversationQueryService.listConversations(viewer, args));
    }

    @GetMapping("/count")
    public ApiResponse<Long> totalCount(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "channel_id", required = false) String channelId,
            @RequestParam(value = "brand_id", required = false) String brandId,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "integration_type", required = false) String integrationType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "starred", required = false) Boolean starred,
            @RequestParam(value = "participating", required = false) Boolean participating,
            @RequestParam(value = "unassigned", required = false) Boolean unassigned,
            @RequestParam(value = "search_value", required = false) String searchValue
    ) {
        var viewer = viewerResolver.resolve(authorization);
        var args = new ConversationListArgs(ids, channelId, brandId, tag, integrationType, status,
                Boolean.TRUE.equals(starred), Boolean.TRUE.equals(participating), Boolean.TRUE.equals(unassigned),
                searchValue, 0);
        return ApiResponse.ok(conversationQueryService.totalCount(viewer, args));
    }

    @GetMapping("/last")
    public ApiResponse<ConversationItem> last(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "channel_id", required = false) String channelId,
            @RequestParam(value = "brand_id", required = false) String brandId,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "integration_type", required = false) String integrationType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "starred", required = false) Boolean starred,
            @RequestParam(value = "participating", required = false) Boolean participating,
            @RequestParam(value = "unassigned", required = false) Boolean unassigned,
            @RequestParam(value = "search_value", required = false) String searchValue
    ) {
        var viewer = viewerResolver.resolve(authorization);
        var args = new ConversationListArgs(ids, channelId, brandId, tag, integrationType, status,
                Boolean.TRUE.equals(starred), Boolean.TRUE.equals(participating), Boolean.TRUE.equals(unassigned),
                searchValue, 0);
        return ApiResponse.ok(conversationQueryService.lastConversation(viewer, args).orElse(null));
    }

    @GetMapping("/counts")
    public ApiResponse<ConversationCountsResponse> counts(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "only", required = false) String only,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "channel_id", required = false) String channelId,
            @RequestParam(value = "brand_id", required = false) String brandId,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "integration_type", required = false) String integrationType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "starred", required = false) Boolean starred,
            @RequestParam(value = "participating", required = false) Boolean participating,
            @RequestParam(value = "unassigned", required = false) Boolean unassigned
    ) {
        var viewer = viewerResolver.resolve(authorization);
        var args = new ConversationListArgs(ids, channelId, brandId, tag, integrationType, status,
                Boolean.TRUE.equals(starred), Boolean.TRUE.equals(participating), Boolean.TRUE.equals(unassigned),
                null, 0);
        return ApiResponse.ok(conversationQueryService.counts(viewer, args, only));
    }

    @GetMapping("/unread-count")
    public ApiResponse<Long> unreadCount(
            @RequestHeader(value = "Authorization", required = false) String authorization
    ) {
        var viewer = viewerResolver.resolve(authorization);
        return ApiResponse.ok(conversationQueryService.totalUnreadCount(viewer));
    }

    @GetMapping("/{id}")
    public ApiResponse<ConversationDetailResponse> detail(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String conversationId
    ) {
        var viewer = viewerResolver.resolve(authorization);
        return ApiResponse.ok(conversationQueryService.detail(viewer, conversationId));
    }

    @GetMapping("/{id}/messages")
    public ApiResponse<List<ConversationMessageItem>> messages(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String conversationId,
            @RequestParam(value = "skip", required = false) @Min(0) Integer skip,
            @RequestParam(value = "limit", required = false) @Min(0) Integer limit
    ) {
        var viewer = viewerResolver.resolve(authorization);
        return ApiResponse.ok(conversationQueryService.messages(viewer, conversationId, skip, limit));
    }

    @GetMapping("/{id}/messages/count")
    public ApiResponse<Long> messagesTotalCount(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String conversationId
    ) {
        var viewer = viewerResolver.resolve(authorization);
        return ApiResponse.ok(conversationQueryService.messagesTotalCount(viewer, conversationId));
    }
}
