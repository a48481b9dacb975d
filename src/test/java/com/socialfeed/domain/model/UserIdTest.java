package com.socialfeed.domain.model;

import com.socialfeed.domain.error.ValidationError.UserIdError;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserIdTest {

    private static final String VALID_UUID = "550e8400-e29b-41d4-a716-446655440000";

    @Test
    void parseShouldSucceedWithValidUUID() {
        var result = UserId.parse(VALID_UUID);
        assertTrue(result.isSuccess());
        assertEquals(UUID.fromString(VALID_UUID), result.getOrThrow().value());
    }

    @Test
    void parseShouldTrimSurroundingWhitespace() {
        var result = UserId.parse("  " + VALID_UUID + " ");
        assertTrue(result.isSuccess());
        assertEquals(VALID_UUID, result.getOrThrow().toString());
    }

    @Test
    void parseShouldFailWithNullValue() {
        var result = UserId.parse(null);
        assertTrue(result.isFailure());
        assertInstanceOf(UserIdError.Empty.class, result.errorOrNull());
    }

    @Test
    void parseShouldFailWithBlankValue() {
        var result = UserId.parse("   ");
        assertTrue(result.isFailure());
        assertInstanceOf(UserIdError.Empty.class, result.errorOrNull());
    }

    @Test
    void parseShouldFailWithInvalidUUIDFormat() {
        var result = UserId.parse("not-a-uuid");
        assertTrue(result.isFailure());
        assertInstanceOf(UserIdError.InvalidFormat.class, result.errorOrNull());
    }

    @Test
    void fromTrustedShouldFailLoudlyOnCorruptedValue() {
        assertThrows(IllegalStateException.class, () -> UserId.fromTrusted("corrupted"));
    }

    @Test
    void shouldCreateFromUUID() {
        UUID uuid = UUID.randomUUID();
        assertEquals(uuid, UserId.of(uuid).value());
    }

    @Test
    void shouldOrderByCanonicalString() {
        UserId a = UserId.parse("00000000-0000-0000-0000-00000000000a").getOrThrow();
        UserId b = UserId.parse("00000000-0000-0000-0000-00000000000b").getOrThrow();
        List<UserId> ids = new ArrayList<>(List.of(b, a));

        ids.sort(null);

        assertEquals(List.of(a, b), ids);
    }
}
