package org.fpbjs.amlmapper.fpb.models;

public record FpbProject(
        String name,
        String targetNamespace,
        String entryPoint   // id of the entry process
) {
}
