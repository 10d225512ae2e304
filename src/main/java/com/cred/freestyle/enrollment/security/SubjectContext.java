package com.cred.freestyle.enrollment.security;

/**
 * Authenticated caller identity passed into the enrollment operations.
 *
 * @author Enrollment Team
 */
public class SubjectContext {

    private final String subjectId;
    private final String role;
    private final String email;

    public SubjectContext(String subjectId, String role, String email) {
        this.subjectId = subjectId;
        this.role = role;
        this.email = email;
    }

    public static SubjectContext of(String subjectId, String email) {
        return new SubjectContext(subjectId, SecurityUtils.ROLE_MEMBER, email);
    }

    public String getSubjectId() {
        return subjectId;
    }

    /**
     * Role name without the ROLE_ prefix.
     */
    public String getRole() {
        return role;
    }

    /**
     * Contact address, may be null.
     */
    public String getEmail() {
        return email;
    }

    public boolean isAdmin() {
        return SecurityUtils.ROLE_ADMIN.equals(role);
    }

    @Override
    public String toString() {
        return "SubjectContext{subjectId=" + subjectId + ", role=" + role + "}";
    }
}
