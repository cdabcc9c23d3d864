package com.deskhub.inbox.channel.service;

import com.deskhub.inbox.channel.api.ChannelItem;
import com.deskhub.inbox.channel.repo.ChannelRepository;
import com.deskhub.inbox.common.api.Pagination;
import com.deskhub.inbox.common.query.Predicate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ChannelQueryService {

    private final ChannelRepository channelRepository;

    public ChannelQueryService(ChannelRepository channelRepository) {
        this.channelRepository = channelRepository;
    }

    /**
     * Newest first. {@code memberIds} keeps channels having any of the given members.
     */
    public List<ChannelItem> listChannels(String tenantId, List<String> memberIds, Pagination pagination) {
        var filter = Predicate.eq("tenantId", tenantId);
        if (memberIds != null && !memberIds.isEmpty()) {
            filter = Predicate.and(filter, Predicate.in("memberIds", memberIds));
        }
        return channelRepository.listPage(filter, pagination).stream()
                .map(this::toItem)
                .toList();
    }

    public Optional<ChannelItem> findChannel(String tenantId, String channelId) {
        return channelRepository.findById(tenantId, channelId).map(this::toItem);
    }

    public long totalCount(String tenantId) {
        return channelRepository.count(Predicate.eq("tenantId", tenantId));
    }

    public Optional<ChannelItem> lastChannel(String tenantId) {
        return channelRepository.findLast(tenantId).map(this::toItem);
    }

    private ChannelItem toItem(ChannelRepository.ChannelRow row) {
        return new ChannelItem(
                row.id(),
                row.name(),
                row.description(),
                channelRepository.listMemberIds(row.id()),
                channelRepository.listIntegrationIds(row.id()),
                row.createdAt().getEpochSecond()
        );
    }
}
