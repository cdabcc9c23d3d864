package com.deskhub.inbox.company.api;

import com.deskhub.inbox.auth.service.ViewerResolver;
import com.deskhub.inbox.common.api.ApiResponse;
import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.company.service.CompanyListArgs;
import com.deskhub.inbox.company.service.CompanyQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/companies")
public class CompanyController {

    private final CompanyQueryService companyQueryService;
    private final ViewerResolver viewerResolver;

    public CompanyController(CompanyQueryService companyQueryService, ViewerResolver viewerResolver) {
        this.companyQueryService = companyQueryService;
        this.viewerResolver = viewerResolver;
    }

    @GetMapping
    public ApiResponse<List<CompanyItem>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "search_value", required = false) String searchValue,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "lead_status", required = false) String leadStatus,
            @RequestParam(value = "lifecycle_state", required = false) String lifecycleState,
            @RequestParam(value = "sort_field", required = false) String sortField,
            @RequestParam(value = "sort_direction", required = false) Integer sortDirection,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "per_page", required = false) Integer perPage
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        var args = new CompanyListArgs(ids, searchValue, tag, leadStatus, lifecycleState);
        return ApiResponse.ok(companyQueryService.listCompanies(
                claims.tenantId(), args, sortField, sortDirection, Pagination.of(page, perPage)));
    }

    @GetMapping("/count")
    public ApiResponse<Long> totalCount(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "ids", required = false) List<String> ids,
            @RequestParam(value = "search_value", required = false) String searchValue,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "lead_status", required = false) String leadStatus,
            @RequestParam(value = "lifecycle_state", required = false) String lifecycleState
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        var args = new CompanyListArgs(ids, searchValue, tag, leadStatus, lifecycleState);
        return ApiResponse.ok(companyQueryService.totalCount(claims.tenantId(), args));
    }

    @GetMapping("/counts")
    public ApiResponse<Map<String, Long>> counts(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(value = "only") String only,
            @RequestParam(value = "search_value", required = false) String searchValue,
            @RequestParam(value = "tag", required = false) String tag,
            @RequestParam(value = "lead_status", required = false) String leadStatus,
            @RequestParam(value = "lifecycle_state", required = false) String lifecycleState
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        var args = new CompanyListArgs(null, searchValue, tag, leadStatus, lifecycleState);
        return ApiResponse.ok(companyQueryService.counts(claims.tenantId(), args, only));
    }

    @GetMapping("/{id}")
    public ApiResponse<CompanyItem> detail(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String id
    ) {
        var claims = viewerResolver.requireStaff(authorization);
        return ApiResponse.found(companyQueryService.findCompany(claims.tenantId(), id), "company_not_found");
    }
}
