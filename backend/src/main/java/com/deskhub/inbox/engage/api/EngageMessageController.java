package com.deskhub.inbox.engage.api;

import com.deskhub.inbox.auth.service.ViewerResolver;
import com.deskhub.inbox.common.api.ApiResponse;
import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.engage.service.EngageListArgs;
import com.deskhub.inbox.engage.service.EngageQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/engage-messages")
public class EngageMessageController {

    private final EngageQueryService engageQueryService;
    private final ViewerResolver viewerResolver;

    public EngageMessageController(EngageQueryService engageQueryService, ViewerResolver viewerResolver) {
        this.engageQueryService = engageQueryService;
        this.viewerResolver = viewerResolver;
    }

    @GetMapping
    public ApiResponse<List<EngageMessageItem>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "kind", required = false) String kind,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "segment_ids", required = false) List<String> segmentIds,
            @RequestParam(value = "brand_ids", required = false) List<String> brandIds,
            @RequestParam(value = "tag_ids", required = false) List<String> tagIds,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "per_page", required = false) Integer perPage
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        var args = new EngageListArgs(kind, status, tag, ids, segmentIds, brandIds, tagIds);
        return ApiResponse.ok(engageQueryService.listMessages(
                claims.tenantId(), args, claims.userId(), Pagination.of(page, perPage)));
    }

    @GetMapping("/count")
    public ApiResponse<Long> totalCount(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "kind", required = false) String kind,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "segment_ids", required = false) List<String> segmentIds,
            @RequestParam(value = "brand_ids", required = false) List<String> brandIds,
            @RequestParam(value = "tag_ids", required = false) List<String> tagIds
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        var args = new EngageListArgs(kind, status, tag, ids, segmentIds, brandIds, tagIds);
        return ApiResponse.ok(engageQueryService.totalCount(claims.tenantId(), args, claims.userId()));
    }

    @GetMapping("/counts")
    public ApiResponse<Map<String, Long>> counts(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "name") String name,
            @RequestParam(value = "kind", required = false) String kind,
            @RequestParam(value = "status", required = false) String status
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.ok(engageQueryService.counts(claims.tenantId(), name, kind, status, claims.userId()));
    }

    @GetMapping("/{id}")
    public ApiResponse<EngageMessageItem> detail(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String id
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.found(engageQueryService.findMessage(claims.tenantId(), id), "engage_message_not_found");
    }
}
