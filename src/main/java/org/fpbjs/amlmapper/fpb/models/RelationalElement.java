package org.fpbjs.amlmapper.fpb.models;

public record RelationalElement(
        String view,
        String model,
        String regulationsForRelationalGeneration
) {
}
