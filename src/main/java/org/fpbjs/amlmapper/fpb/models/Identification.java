package org.fpbjs.amlmapper.fpb.models;

/**
 * Identification block of an FPD object or characteristic (VDI 3682).
 * All fields are free text; missing values are kept as null.
 */
public record Identification(
        String uniqueIdent,
        String longName,
        String shortName,
        String versionNumber,
        String revisionNumber
) {
}
