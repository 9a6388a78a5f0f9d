package com.blogicum.application.port.out;

import java.util.UUID;

/**
 * Port for generating primary keys of new rows.
 */
public interface IdGenerator {

    /**
     * Generates a new unique identifier. Identifiers generated later sort after earlier ones.
     */
    UUID generate();
}
