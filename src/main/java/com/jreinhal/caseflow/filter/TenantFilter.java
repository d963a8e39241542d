package com.jreinhal.caseflow.filter;

import com.jreinhal.caseflow.model.User;
import com.jreinhal.caseflow.security.TenantResolver;
import com.jreinhal.caseflow.service.AuditService;
import com.jreinhal.caseflow.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller identity for {@code /api/**} requests. Requests without an identity
 * are rejected with 401 before reaching a controller.
 */
@Component
@Order(value=2)
public class TenantFilter
extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(TenantFilter.class);
    private static final String API_PREFIX = "/api/";
    private final TenantResolver tenantResolver;
    private final AuditService auditService;

    public TenantFilter(TenantResolver tenantResolver, AuditService auditService) {
        this.tenantResolver = tenantResolver;
        this.auditService = auditService;
        log.info("Tenant filter initialized with auth mode: {}", tenantResolver.getAuthMode());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain) throws IOException, ServletException {
        User user = this.tenantResolver.resolve(request);
        if (user == null) {
            log.warn("Authentication failed for path: {} from IP: {}", LogSanitizer.sanitize(request.getRequestURI()), request.getRemoteAddr());
            this.auditService.logAuthFailure("No valid gateway identity", request);
            response.setStatus(401);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":true,\"code\":\"UNAUTHENTICATED\",\"message\":\"Authentication required\"}");
            return;
        }
        SecurityContext.setCurrentUser(user);
        this.setSpringSecurityContext(user);
        try {
            chain.doFilter(request, response);
        }
        finally {
            SecurityContext.clear();
            SecurityContextHolder.clearContext();
        }
    }

    private void setSpringSecurityContext(User user) {
        org.springframework.security.core.context.SecurityContext context = SecurityContextHolder.getContext();
        if (context.getAuthentication() != null && context.getAuthentication().isAuthenticated()) {
            return;
        }
        String role = user.isSoloLawyer() ? "ROLE_SOLO_LAWYER" : "ROLE_FIRM_MEMBER";
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(user, null, List.of(new SimpleGrantedAuthority(role)));
        context.setAuthentication(auth);
    }
}
