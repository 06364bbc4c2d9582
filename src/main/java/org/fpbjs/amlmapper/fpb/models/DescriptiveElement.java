package org.fpbjs.amlmapper.fpb.models;

public record DescriptiveElement(
        String valueDeterminationProcess,
        String representivity,
        String setpointValue,
        String validityLimits,
        String actualValues
) {
}
