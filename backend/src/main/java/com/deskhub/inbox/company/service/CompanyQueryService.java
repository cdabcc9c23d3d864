package com.deskhub.inbox.company.service;

import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.common.constants.CompanyLeadStatus;
import com.deskhub.inbox.common.constants.CompanyLifecycleState;
import com.deskhub.inbox.common.constants.TagType;
import com.deskhub.inbox.common.query.JdbcCollection;
import com.deskhub.inbox.common.query.Predicate;
import com.deskhub.inbox.company.api.CompanyItem;
import com.deskhub.inbox.company.repo.CompanyRepository;
import com.deskhub.inbox.tag.repo.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class CompanyQueryService {

    private static final Logger log = LoggerFactory.getLogger(CompanyQueryService.class);

    private static final String DEFAULT_SORT_FIELD = "createdAt";

    private final CompanyRepository companyRepository;
    private final TagRepository tagRepository;

    public CompanyQueryService(CompanyRepository companyRepository, TagRepository tagRepository) {
        this.companyRepository = companyRepository;
        this.tagRepository = tagRepository;
    }

    /**
     * {@code ids} bypasses every other filter. Tags outside the company partition match nothing.
     */
    public Predicate listQuery(String tenantId, CompanyListArgs args) {
        var common = Predicate.eq("tenantId", tenantId);
        if (!args.ids().isEmpty()) {
            return Predicate.and(common, Predicate.in("id", args.ids()));
        }

        Predicate tag = Predicate.all();
        if (args.tag() != null) {
            tag = tagRepository.findByIdAndType(tenantId, args.tag(), TagType.COMPANY)
                    .map(t -> Predicate.eq("tagIds", t.id()))
                    .orElse(Predicate.none());
        }

        return Predicate.and(
                common,
                Predicate.text(args.searchValue(), "name", "website"),
                tag,
                args.leadStatus() == null ? null : Predicate.eq("leadStatus", args.leadStatus()),
                args.lifecycleState() == null ? null : Predicate.eq("lifecycleState", args.lifecycleState())
        );
    }

    /**
     * {@code sortDirection} follows the 1 / -1 convention; newest first when no sort is given.
     */
    public List<CompanyItem> listCompanies(
            String tenantId,
            CompanyListArgs args,
            String sortField,
            Integer sortDirection,
            Pagination pagination
    ) {
        var field = sortField == null || sortField.isBlank() ? DEFAULT_SORT_FIELD : sortField;
        if (!companyRepository.isSortable(field)) {
            throw new IllegalArgumentException("invalid_sort_field");
        }
        JdbcCollection.Direction direction;
        if (sortDirection == null) {
            direction = JdbcCollection.Direction.DESC;
        } else if (sortDirection == 1) {
            direction = JdbcCollection.Direction.ASC;
        } else if (sortDirection == -1) {
            direction = JdbcCollection.Direction.DESC;
        } else {
            throw new IllegalArgumentException("invalid_sort_direction");
        }

        return companyRepository.listPage(listQuery(tenantId, args), field, direction, pagination).stream()
                .map(this::toItem)
                .toList();
    }

    public long totalCount(String tenantId, CompanyListArgs args) {
        return companyRepository.count(listQuery(tenantId, args));
    }

    public Optional<CompanyItem> findCompany(String tenantId, String id) {
        return companyRepository.findById(tenantId, id).map(this::toItem);
    }

    /**
     * Counts of one group over the list filters. The group's own filter is left out of the base
     * so every key reflects the other filters only.
     */
    public Map<String, Long> counts(String tenantId, CompanyListArgs args, String only) {
        var group = CompanyCountGroup.fromValue(only)
                .orElseThrow(() -> new IllegalArgumentException("invalid_only"));

        var counts = new LinkedHashMap<String, Long>();
        if (group == CompanyCountGroup.BY_TAGS) {
            var base = listQuery(tenantId, withoutTag(args));
            for (var tag : tagRepository.listByType(tenantId, TagType.COMPANY)) {
                counts.put(tag.id(), companyRepository.count(Predicate.and(base, Predicate.eq("tagIds", tag.id()))));
            }
        } else if (group == CompanyCountGroup.BY_LEAD_STATUS) {
            var base = listQuery(tenantId, new CompanyListArgs(
                    args.ids(), args.searchValue(), args.tag(), null, args.lifecycleState()));
            for (var status : CompanyLeadStatus.allValues()) {
                counts.put(status, companyRepository.count(Predicate.and(base, Predicate.eq("leadStatus", status))));
            }
        } else {
            var base = listQuery(tenantId, new CompanyListArgs(
                    args.ids(), args.searchValue(), args.tag(), args.leadStatus(), null));
            for (var state : CompanyLifecycleState.allValues()) {
                counts.put(state, companyRepository.count(Predicate.and(base, Predicate.eq("lifecycleState", state))));
            }
        }
        log.debug("company_counts tenant={} only={} keys={}", tenantId, group.value(), counts.size());
        return counts;
    }

    private static CompanyListArgs withoutTag(CompanyListArgs args) {
        return new CompanyListArgs(args.ids(), args.searchValue(), null, args.leadStatus(), args.lifecycleState());
    }

    private CompanyItem toItem(CompanyRepository.CompanyRow row) {
        return new CompanyItem(
                row.id(),
                row.name(),
                row.website(),
                row.industry(),
                row.plan(),
                row.size(),
                row.leadStatus(),
                row.lifecycleState(),
                companyRepository.listTagIds(row.id()),
                row.createdAt().getEpochSecond(),
                row.modifiedAt().getEpochSecond()
        );
    }
}
