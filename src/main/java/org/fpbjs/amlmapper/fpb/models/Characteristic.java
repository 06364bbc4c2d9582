package org.fpbjs.amlmapper.fpb.models;

/**
 * One characteristic of an object. Each of the three sub-blocks is optional (null when absent).
 */
public record Characteristic(
        Identification identification,
        DescriptiveElement descriptiveElement,
        RelationalElement relationalElement
) {
}
