package com.cred.freestyle.enrollment.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the authenticated caller from the security context.
 *
 * @author Enrollment Team
 */
public final class SecurityUtils {

    public static final String ROLE_MEMBER = "MEMBER";
    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_PAYMENT_PROVIDER = "PAYMENT_PROVIDER";

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated subject ID.
     *
     * @return Subject ID, or null if not authenticated
     */
    public static String getCurrentSubjectId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.isAuthenticated()) {
            return authentication.getName();
        }
        return null;
    }

    /**
     * @return Contact address from the X-User-Email header, or null
     */
    public static String getCurrentEmail() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getDetails() instanceof String) {
            return (String) authentication.getDetails();
        }
        return null;
    }

    /**
     * Check if the current caller has a role.
     *
     * @param role Role to check (without ROLE_ prefix)
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }
        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            if (roleWithPrefix.equals(authority.getAuthority())) {
                return true;
            }
        }
        return false;
    }

    public static boolean isAdmin() {
        return hasRole(ROLE_ADMIN);
    }

    /**
     * Build the subject context for the current request.
     *
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static SubjectContext currentSubject() {
        String subjectId = getCurrentSubjectId();
        if (subjectId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        String role = isAdmin() ? ROLE_ADMIN : ROLE_MEMBER;
        return new SubjectContext(subjectId, role, getCurrentEmail());
    }
}
