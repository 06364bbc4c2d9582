package org.fpbjs.amlmapper.fpb.models;

import lombok.Builder;
import org.fpbjs.amlmapper.mapping.NodeKind;

import java.util.ArrayList;
import java.util.List;

@Builder
public record FpbElement(
        NodeKind kind,
        String id,
        String name,
        Identification identification,   // optional
        List<Characteristic> characteristics,
        List<String> incoming,            // flow ids
        List<String> outgoing,            // flow ids
        List<String> isAssignedTo,        // element ids

        // for process operators
        String decomposedView,            // id of the child process, optional

        // for system limits
        List<String> elementsContainer
) {
    public FpbElement {
        if (characteristics == null) {
            characteristics = new ArrayList<>();
        }
        if (incoming == null) {
            incoming = new ArrayList<>();
        }
        if (outgoing == null) {
            outgoing = new ArrayList<>();
        }
        if (isAssignedTo == null) {
            isAssignedTo = new ArrayList<>();
        }
        if (elementsContainer == null) {
            elementsContainer = new ArrayList<>();
        }
    }
}
