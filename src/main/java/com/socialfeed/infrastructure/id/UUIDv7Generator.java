package com.socialfeed.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.socialfeed.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * UUIDv7 ids: the leading 48 bits are the creation time in epoch milliseconds,
 * so ids sort by creation across processes.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator = Generators.timeBasedEpochGenerator();

    @Override
    public UUID generate() {
        return generator.generate();
    }

    @Override
    public long extractTimestamp(UUID uuid) {
        if (uuid.version() != 7) {
            throw new IllegalArgumentException("Not a time-ordered UUIDv7: " + uuid);
        }
        return uuid.getMostSignificantBits() >>> 16;
    }
}
