package io.changestream.api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Records the caller identity token for the request. Not an authentication step: the token is
 * taken as given and only used as cursor owner, default event source and log context.
 */
@Component
@Order(5)
public class IdentityFilter implements Filter {
    public static final String HEADER = "X-CS-Identity";
    public static final String ATTRIBUTE = "changestream.identity";
    public static final String ANONYMOUS = "anonymous";
    static final String MDC_KEY = "identity";

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain) throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        String header = r.getHeader(HEADER);
        String identity = (header == null || header.isBlank()) ? ANONYMOUS : header.trim();
        req.setAttribute(ATTRIBUTE, identity);
        MDC.put(MDC_KEY, identity);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String orAnonymous(String identity) {
        return (identity == null || identity.isBlank()) ? ANONYMOUS : identity;
    }
}
