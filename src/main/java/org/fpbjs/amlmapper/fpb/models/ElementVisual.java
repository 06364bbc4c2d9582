package org.fpbjs.amlmapper.fpb.models;

import org.fpbjs.amlmapper.mapping.NodeKind;

/**
 * Shape bounds of an element. Numbers are null when absent from the source document.
 */
public record ElementVisual(
        String id,
        NodeKind type,
        Double x,
        Double y,
        Double width,
        Double height
) {
}
