package com.deskhub.inbox.auth.service;

import com.deskhub.inbox.auth.service.jwt.JwtClaims;
import com.deskhub.inbox.auth.service.jwt.JwtService;
import com.deskhub.inbox.conversation.repo.ConversationMarkRepository;
import org.springframework.stereotype.Component;

/**
 * Turns an {@code Authorization} header into the staff {@link Viewer} a query runs for.
 */
@Component
public class ViewerResolver {

    private final JwtService jwtService;
    private final ConversationMarkRepository conversationMarkRepository;

    public ViewerResolver(JwtService jwtService, ConversationMarkRepository conversationMarkRepository) {
        this.jwtService = jwtService;
        this.conversationMarkRepository = conversationMarkRepository;
    }

    public JwtClaims requireStaff(String authorization) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        if (claims.tenantId() == null || claims.tenantId().isBlank() || !claims.isStaff()) {
            throw new IllegalArgumentException("forbidden");
        }
        return claims;
    }

    public Viewer resolve(String authorization) {
        var claims = requireStaff(authorization);
        var starred = conversationMarkRepository.listStarredConversationIds(claims.tenantId(), claims.userId());
        return new Viewer(claims.userId(), claims.tenantId(), starred);
    }
}
