package com.company.incidentrisk.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Identity of the authenticated caller, taken from the JWT.
 */
@Component
public class CallerContext {

    public String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.getPrincipal() instanceof Jwt jwt) {
            String subject = jwt.getClaimAsString("sub");
            return subject != null ? subject : "unknown";
        }

        return "anonymous";
    }
}
