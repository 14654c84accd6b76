package com.company.podwatch.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Identifies the operator behind the current request, for audit logging of admin actions
 */
@Component
@Slf4j
public class OperatorContext {

    public static final String ANONYMOUS = "anonymous";

    /**
     * Subject claim of the JWT, or "anonymous" when there is no token
     */
    public String getCurrentOperatorId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return ANONYMOUS;
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String subject = jwt.getSubject();
            return subject != null ? subject : ANONYMOUS;
        }

        log.debug("Non-JWT principal type: {}", authentication.getPrincipal().getClass());
        return authentication.getName();
    }

    public String getCurrentOperatorEmail() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            String email = jwt.getClaimAsString("email");
            if (email == null) {
                email = jwt.getClaimAsString("preferred_username");
            }
            return email;
        }

        return null;
    }

    /**
     * "id (email)" when both are known
     */
    public String describe() {
        String email = getCurrentOperatorEmail();
        String id = getCurrentOperatorId();
        return email != null ? id + " (" + email + ")" : id;
    }
}
