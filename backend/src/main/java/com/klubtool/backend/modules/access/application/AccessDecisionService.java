package com.klubtool.backend.modules.access.application;

import java.util.Optional;

import com.klubtool.backend.global.error.ProblemException;
import com.klubtool.backend.modules.access.domain.AccessAction;
import com.klubtool.backend.modules.access.domain.AccessRule;
import com.klubtool.backend.modules.access.domain.AccessTarget;
import com.klubtool.backend.modules.access.domain.MembershipContext;
import com.klubtool.backend.modules.access.domain.VisibilityScope;
import com.klubtool.backend.modules.auth.domain.Permission;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Allow/deny decisions. First match wins: anonymous, superuser, permission string,
 * structural role on the owning group, membership visibility, otherwise deny.
 */
@Service
public class AccessDecisionService {

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionService.class);

    private final AccessPolicy policy;

    public AccessDecisionService(AccessPolicy policy) {
        this.policy = policy;
    }

    public boolean can(MembershipContext context, AccessAction action, AccessTarget target) {
        if (context == null || !context.authenticated()) {
            return false;
        }
        if (context.superuser()) {
            return true;
        }
        Optional<AccessRule> maybeRule = policy.ruleFor(target.resource(), action);
        if (maybeRule.isEmpty()) {
            return false;
        }
        AccessRule rule = maybeRule.get();
        if (rule.superuserOnly()) {
            return false;
        }
        if (rule.permissionGrants() && hasPermission(context, action, target)) {
            return true;
        }
        if (!rule.structuralRoles().isEmpty() && target.groupId() != null
                && context.rolesIn(target.groupId()).stream().anyMatch(rule.structuralRoles()::contains)) {
            return true;
        }
        for (VisibilityScope scope : rule.visibilityScopes()) {
            if (scope.covers(context, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Throws the uniform forbidden problem when {@link #can} denies.
     */
    public void require(MembershipContext context, AccessAction action, AccessTarget target) {
        if (!can(context, action, target)) {
            log.debug("Access denied: user={} action={} resource={} group={}",
                    context == null ? null : context.userId(), action, target.resource(), target.groupId());
            throw ProblemException.forbidden();
        }
    }

    /**
     * Whether the user reaches every object of the resource, not only those visible through membership.
     * List endpoints use this to decide between unfiltered and membership-filtered rows.
     */
    public boolean hasGlobalAccess(MembershipContext context, AccessAction action, AccessTarget target) {
        if (context == null || !context.authenticated()) {
            return false;
        }
        if (context.superuser()) {
            return true;
        }
        return policy.ruleFor(target.resource(), action)
                .filter(rule -> !rule.superuserOnly() && rule.permissionGrants())
                .map(rule -> hasPermission(context, action, target))
                .orElse(false);
    }

    private boolean hasPermission(MembershipContext context, AccessAction action, AccessTarget target) {
        return Permission.of(target.resource().permissionDomain(), action.permissionAction())
                .map(context::hasPermission)
                .orElse(false);
    }
}
