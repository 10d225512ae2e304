package com.cred.freestyle.enrollment.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Authentication filter that trusts identity headers set by the API gateway.
 *
 * Headers:
 * - X-User-Id: Subject identifier (required for authenticated requests)
 * - X-User-Role: MEMBER, ADMIN or PAYMENT_PROVIDER (optional, defaults to MEMBER)
 * - X-User-Email: Contact address (optional), kept as the authentication details
 *
 * @author Enrollment Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String USER_EMAIL_HEADER = "X-User-Email";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String subjectId = request.getHeader(USER_ID_HEADER);

        if (subjectId != null && !subjectId.isBlank()) {
            String role = request.getHeader(USER_ROLE_HEADER);
            if (role == null || role.isBlank()) {
                role = SecurityUtils.ROLE_MEMBER;
            }
            if (!role.startsWith("ROLE_")) {
                role = "ROLE_" + role;
            }

            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    subjectId, null, Collections.singletonList(new SimpleGrantedAuthority(role)));

            String email = request.getHeader(USER_EMAIL_HEADER);
            if (email != null && !email.isBlank()) {
                authentication.setDetails(email.trim());
            }

            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated subject: {} with role: {}", subjectId, role);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }
}
