package com.deskhub.inbox.auth.service.jwt;

public record JwtClaims(
        String userId,
        String tenantId,
        String role,
        String username
) {

    public boolean isStaff() {
        return "agent".equals(role) || "admin".equals(role);
    }
}
