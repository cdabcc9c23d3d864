package com.deskhub.inbox.channel.api;

import com.deskhub.inbox.auth.service.ViewerResolver;
import com.deskhub.inbox.channel.service.ChannelQueryService;
import com.deskhub.inbox.common.api.ApiResponse;
import com.deskhub.inbox.common.api.Pagination;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/channels")
public class ChannelController {

    private final ChannelQueryService channelQueryService;
    private final ViewerResolver viewerResolver;

    public ChannelController(ChannelQueryService channelQueryService, ViewerResolver viewerResolver) {
        this.channelQueryService = channelQueryService;
        this.viewerResolver = viewerResolver;
    }

    @GetMapping
    public ApiResponse<List<ChannelItem>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "member_ids", required = false) List<String> memberIds,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "per_page", required = false) Integer perPage
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.ok(channelQueryService.listChannels(claims.tenantId(), memberIds, Pagination.of(page, perPage)));
    }

    @GetMapping("/count")
    public ApiResponse<Long> totalCount(
            @RequestHeader(value = "Authorization", required = false) String authorization
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.ok(channelQueryService.totalCount(claims.tenantId()));
    }

    @GetMapping("/last")
    public ApiResponse<ChannelItem> last(
            @RequestHeader(value = "Authorization", required = false) String authorization
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.ok(channelQueryService.lastChannel(claims.tenantId()).orElse(null));
    }

    @GetMapping("/{id}")
    public ApiResponse<ChannelItem> detail(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String channelId
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.found(channelQueryService.findChannel(claims.tenantId(), channelId), "channel_not_found");
    }
}
