package org.fpbjs.amlmapper.util;

import java.util.UUID;

public class UuidIdGenerator implements IdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
