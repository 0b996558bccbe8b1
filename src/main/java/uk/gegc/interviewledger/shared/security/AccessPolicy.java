package uk.gegc.interviewledger.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.interviewledger.shared.exception.ForbiddenException;

import java.util.UUID;

/**
 * Tenant and role checks shared by the credit and interview services.
 */
@Component
@Slf4j
public class AccessPolicy {

    private static final String DEFAULT_FORBIDDEN_MESSAGE = "Access denied";

    /**
     * System callers act across tenants; everyone else must belong to the resource's organization.
     */
    public void requireSameTenant(CallerContext caller, UUID resourceOrgId) {
        if (caller == null) {
            throwForbidden("Caller identity missing");
        }
        if (caller.isSystem()) {
            return;
        }
        if (caller.orgId() == null || !caller.orgId().equals(resourceOrgId)) {
            throwForbidden("Resource belongs to another organization");
        }
    }

    public void requireOrgAdmin(CallerContext caller, UUID resourceOrgId) {
        requireSameTenant(caller, resourceOrgId);
        if (!caller.isSystem() && caller.role() != CallerRole.ORG_ADMIN) {
            throwForbidden("Organization admin role required");
        }
    }

    public void requireSystem(CallerContext caller) {
        if (caller == null || !caller.isSystem()) {
            throwForbidden("System role required");
        }
    }

    /**
     * Students may only act on their own records; admins and system callers act within the tenant.
     */
    public void requireSelfOrAdmin(CallerContext caller, UUID studentId, UUID resourceOrgId) {
        requireSameTenant(caller, resourceOrgId);
        if (caller.role() == CallerRole.STUDENT && !caller.isSelf(studentId)) {
            throwForbidden("Students may only act on their own records");
        }
    }

    private void throwForbidden(String message) {
        String resolved = message == null || message.isBlank() ? DEFAULT_FORBIDDEN_MESSAGE : message;
        log.debug("Access denied: {}", resolved);
        throw new ForbiddenException(resolved);
    }
}
