package com.jreinhal.caseflow.security;

import com.jreinhal.caseflow.model.User;
import jakarta.servlet.http.HttpServletRequest;

public interface TenantResolver {
    /**
     * @return the verified caller, or null when the request carries no usable identity
     */
    public User resolve(HttpServletRequest request);

    public String getAuthMode();
}
