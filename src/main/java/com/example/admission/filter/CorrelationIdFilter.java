package com.example.admission.filter;

import com.example.admission.correlation.CorrelationContext;
import com.example.admission.correlation.CorrelationScope;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Opens a correlation scope around every HTTP request.
 *
 * An inbound {@code X-Correlation-Id} is reused when it looks like an id; otherwise a new one is
 * generated. The id is echoed on the response so callers can quote it.
 */
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Correlation-Id";

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String inbound = request.getHeader(HEADER);
        String correlationId = null;
        if (inbound != null && VALID_ID.matcher(inbound).matches()) {
            correlationId = inbound;
        } else if (inbound != null) {
            // ids end up in log lines; never echo arbitrary header content
            log.debug("Ignoring malformed {} header", HEADER);
        }

        try (CorrelationScope scope = CorrelationContext.open(request.getMethod() + " " + request.getRequestURI(), correlationId)) {
            scope.context().put("remoteAddr", request.getRemoteAddr());
            response.setHeader(HEADER, scope.context().getCorrelationId());
            filterChain.doFilter(request, response);
        }
    }
}
