package com.jreinhal.caseflow.security;

import com.jreinhal.caseflow.model.User;
import com.jreinhal.caseflow.util.LogSanitizer;
import jakarta.servlet.http.HttpServletRequest;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Reads the identity headers the upstream gateway sets after verifying the session.
 * In DEV mode a request without headers runs as the fixed development lawyer.
 */
@Component
public class GatewayHeaderTenantResolver
implements TenantResolver {
    private static final Logger log = LoggerFactory.getLogger(GatewayHeaderTenantResolver.class);
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String FIRM_ID_HEADER = "X-Firm-Id";
    public static final String USER_NAME_HEADER = "X-User-Name";
    private final String authMode;

    public GatewayHeaderTenantResolver(@Value(value="${app.auth-mode:DEV}") String authMode) {
        this.authMode = authMode;
        if ("DEV".equalsIgnoreCase(authMode)) {
            log.warn(">>> DEVELOPMENT AUTH MODE ACTIVE - requests without gateway headers run as the dev user <<<");
        }
    }

    @Override
    public User resolve(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null || userId.isBlank()) {
            return this.isDevMode() ? User.devUser("DEV_LAWYER") : null;
        }
        userId = userId.trim();
        if (!ObjectId.isValid(userId)) {
            log.warn("Rejected malformed {} header: {}", USER_ID_HEADER, LogSanitizer.sanitize(userId));
            return null;
        }
        String firmId = request.getHeader(FIRM_ID_HEADER);
        if (firmId != null && !firmId.isBlank()) {
            firmId = firmId.trim();
            if (!ObjectId.isValid(firmId)) {
                log.warn("Rejected malformed {} header: {}", FIRM_ID_HEADER, LogSanitizer.sanitize(firmId));
                return null;
            }
        } else {
            firmId = null;
        }
        String username = request.getHeader(USER_NAME_HEADER);
        return new User(userId, username != null && !username.isBlank() ? username.trim() : userId, firmId);
    }

    @Override
    public String getAuthMode() {
        return this.authMode;
    }

    private boolean isDevMode() {
        return "DEV".equalsIgnoreCase(this.authMode);
    }
}
