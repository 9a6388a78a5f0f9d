package com.blogicum.domain.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * A resource address the client is sent to after an operation.
 */
public record Location(String path) {

    private static final String API_PREFIX = "/api/v1";

    public static Location profile(String username) {
        return new Location(API_PREFIX + "/profiles/" + encode(username));
    }

    public static Location postDetail(UUID postId) {
        return new Location(API_PREFIX + "/posts/" + postId);
    }

    public static Location comments(UUID postId) {
        return new Location(API_PREFIX + "/posts/" + postId + "/comments");
    }

    public static Location category(String slug) {
        return new Location(API_PREFIX + "/categories/" + encode(slug) + "/posts");
    }

    /**
     * The login entry point, remembering where to come back to.
     */
    public static Location login(String loginUrl, String next) {
        if (next == null || next.isBlank()) {
            return new Location(loginUrl);
        }
        String separator = loginUrl.contains("?") ? "&" : "?";
        return new Location(loginUrl + separator + "next=" + encode(next));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return path;
    }
}
