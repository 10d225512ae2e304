package com.cred.freestyle.enrollment.config;

import com.cred.freestyle.enrollment.security.HeaderAuthenticationFilter;
import com.cred.freestyle.enrollment.security.SecurityUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration.
 *
 * Authentication: identity headers forwarded by the API gateway (see HeaderAuthenticationFilter).
 *
 * Authorization:
 * - /internal/payments/** requires PAYMENT_PROVIDER or ADMIN
 * - /api/v1/admin/** requires ADMIN
 * - Every other endpoint requires an authenticated subject
 * - Method-level @PreAuthorize on controllers for per-endpoint rules
 *
 * @author Enrollment Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/internal/payments/**")
                    .hasAnyRole(SecurityUtils.ROLE_PAYMENT_PROVIDER, SecurityUtils.ROLE_ADMIN)
                .requestMatchers("/api/v1/admin/**").hasRole(SecurityUtils.ROLE_ADMIN)
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            // Missing identity headers yield 401 rather than a login redirect
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            .addFilterBefore(
                headerAuthenticationFilter(),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    @Bean
    public HeaderAuthenticationFilter headerAuthenticationFilter() {
        return new HeaderAuthenticationFilter();
    }
}
