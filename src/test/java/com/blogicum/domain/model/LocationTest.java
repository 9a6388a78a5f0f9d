package com.blogicum.domain.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LocationTest {

    @Test
    void profileShouldEncodeUsername() {
        assertEquals("/api/v1/profiles/a%40b", Location.profile("a@b").path());
    }

    @Test
    void postDetailShouldUsePostId() {
        UUID id = UUID.randomUUID();
        assertEquals("/api/v1/posts/" + id, Location.postDetail(id).path());
    }

    @Test
    void loginShouldCarryEncodedNext() {
        Location login = Location.login("/auth/login/", "/api/v1/posts?page=2");
        assertEquals("/auth/login/?next=%2Fapi%2Fv1%2Fposts%3Fpage%3D2", login.path());
    }

    @Test
    void loginShouldAppendToExistingQuery() {
        assertEquals("/login?x=1&next=%2Fa", Location.login("/login?x=1", "/a").path());
    }
}
