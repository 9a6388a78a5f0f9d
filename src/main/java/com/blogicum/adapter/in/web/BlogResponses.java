package com.blogicum.adapter.in.web;

import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.model.Location;
import com.blogicum.domain.model.Mutation;
import com.blogicum.domain.model.Result;
import com.blogicum.infrastructure.config.AppProperties;
import com.blogicum.infrastructure.context.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.function.Function;

/**
 * Maps use-case outcomes to HTTP responses.
 *
 * <ul>
 *   <li>applied write: {@code appliedStatus}, {@code Location} of the page to continue on</li>
 *   <li>write on someone else's resource: 302 to the resource's detail page</li>
 *   <li>anonymous write: 302 to the login page with {@code next}</li>
 *   <li>not found: 404, invalid input: 400, forbidden: 403</li>
 * </ul>
 */
@Component
public class BlogResponses {

    private final AppProperties appProperties;

    public BlogResponses(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public <T, R> ResponseEntity<?> read(Result<T, BlogError> result, Function<T, R> body, HttpServletRequest request) {
        return result.isSuccess()
            ? ResponseEntity.ok(body.apply(result.getOrThrow()))
            : error(result.errorOrNull(), request);
    }

    public <T, R> ResponseEntity<?> mutation(
            Result<Mutation<T>, BlogError> result,
            HttpStatus appliedStatus,
            Function<T, R> body,
            HttpServletRequest request) {
        if (result.isFailure()) {
            return error(result.errorOrNull(), request);
        }
        Mutation<T> mutation = result.getOrThrow();
        if (mutation instanceof Mutation.Applied<T> applied) {
            R data = applied.value() == null ? null : body.apply(applied.value());
            return ResponseEntity.status(appliedStatus)
                .location(URI.create(applied.target().path()))
                .body(new MutationResponse<>("applied", applied.target().path(), data));
        }
        return redirect(mutation.location(), new MutationResponse<>("redirected", mutation.location().path(), null));
    }

    public ResponseEntity<?> error(BlogError error, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId());
        if (error instanceof BlogError.NotFound) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        if (error instanceof BlogError.AuthenticationRequired) {
            return redirect(Location.login(appProperties.getAuth().getLoginUrl(), requestedPath(request)), body);
        }
        if (error instanceof BlogError.Forbidden) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
        }
        return ResponseEntity.badRequest().body(body);
    }

    private ResponseEntity<?> redirect(Location location, Object body) {
        return ResponseEntity.status(HttpStatus.FOUND)
            .location(URI.create(location.path()))
            .body(body);
    }

    private static String requestedPath(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    public record MutationResponse<T>(String status, String location, T data) {}

    public record ErrorResponse(String error, String message, String requestId) {}
}
