package uk.gegc.interviewledger.shared.security;

import java.util.UUID;

/**
 * Identity of the caller as resolved by the upstream gateway. Tokens are verified before the
 * request reaches this service; only the resulting ids travel in headers.
 *
 * @param callerId the acting user (student or org admin), or a service id for {@link CallerRole#SYSTEM}
 * @param orgId    tenant the caller belongs to; {@code null} only for {@link CallerRole#SYSTEM}
 * @param role     coarse role used for capability checks
 */
public record CallerContext(UUID callerId, UUID orgId, CallerRole role) {

    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String ORG_ID_HEADER = "X-Org-Id";
    public static final String ROLE_HEADER = "X-Caller-Role";

    public static CallerContext system(UUID serviceId) {
        return new CallerContext(serviceId, null, CallerRole.SYSTEM);
    }

    public boolean isSystem() {
        return role == CallerRole.SYSTEM;
    }

    public boolean isSelf(UUID userId) {
        return callerId != null && callerId.equals(userId);
    }
}
