package com.blogicum.infrastructure.id;

import com.blogicum.application.port.out.IdGenerator;
import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * UUIDv7 keys: the leading 48 bits are the Unix epoch millisecond, so rows inserted later sort
 * after earlier ones. Comments use this as the tie-break of their creation order.
 */
@Component
public class TimeOrderedIdGenerator implements IdGenerator {

    private final TimeBasedEpochGenerator generator = Generators.timeBasedEpochGenerator();

    @Override
    public UUID generate() {
        return generator.generate();
    }

    static long epochMillis(UUID id) {
        return id.getMostSignificantBits() >>> 16;
    }
}
