package com.blogicum.infrastructure.filter;

import com.blogicum.application.port.out.UserRepository;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.User;
import com.blogicum.domain.model.UserId;
import com.blogicum.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Attaches the acting user to the request. Requests without {@code X-User-Id} are anonymous;
 * the use cases decide whether that is enough.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    static final String USER_ID_HEADER = "X-User-Id";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final UserRepository userRepository;

    public AuthFilter(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String userIdHeader = request.getHeader(USER_ID_HEADER);

        Actor actor;
        if (userIdHeader == null || userIdHeader.isBlank()) {
            actor = Actor.anonymous();
        } else {
            var userIdResult = UserId.parse(userIdHeader);
            if (userIdResult.isFailure()) {
                var error = userIdResult.errorOrNull();
                log.warn("Invalid {} header: {}", USER_ID_HEADER, error.message());
                writeError(response, HttpServletResponse.SC_BAD_REQUEST, error.code(), error.message(), requestId);
                return;
            }

            Optional<User> user = userRepository.findById(userIdResult.getOrThrow());
            if (user.isEmpty()) {
                log.warn("Unknown user {} on path {}", userIdHeader, path);
                writeError(response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED", "Unknown user", requestId);
                return;
            }
            actor = Actor.of(user.get());
        }

        RequestContext.set(actor, requestId);
        log.debug("Request attributed: actor={}, requestId={}, path={}",
            actor.user().map(User::username).orElse("anonymous"), requestId, path);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private void writeError(HttpServletResponse response, int status, String code, String message, String requestId)
            throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write(
            "{\"error\":\"" + code + "\",\"message\":\"" + message.replace("\"", "'") + "\",\"requestId\":\"" + requestId + "\"}"
        );
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
