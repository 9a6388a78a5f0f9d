package com.blogicum.domain.model;

import com.blogicum.domain.error.ValidationError.UserIdError;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserIdTest {

    @Test
    void shouldParseValidUuid() {
        UUID uuid = UUID.randomUUID();
        var result = UserId.parse(uuid.toString());
        assertTrue(result.isSuccess());
        assertEquals(uuid, result.getOrThrow().value());
    }

    @Test
    void shouldFailOnBlank() {
        assertInstanceOf(UserIdError.Empty.class, UserId.parse("  ").errorOrNull());
    }

    @Test
    void shouldFailOnMalformed() {
        assertInstanceOf(UserIdError.InvalidFormat.class, UserId.parse("not-a-uuid").errorOrNull());
    }

    @Test
    void shouldIgnoreSurroundingWhitespaceInHeaderValue() {
        UUID uuid = UUID.randomUUID();
        assertEquals(UserId.of(uuid), UserId.parse(" " + uuid + " ").getOrThrow());
    }

    @Test
    void shouldRecognizeOwnAuthorship() {
        UserId alice = UserId.random();

        assertTrue(alice.isAuthor(UserId.of(alice.value())));
        assertFalse(alice.isAuthor(UserId.random()));
        assertFalse(alice.isAuthor(null));
    }

    @Test
    void shouldRejectNullValue() {
        assertThrows(IllegalStateException.class, () -> UserId.of(null));
    }
}
