package org.fpbjs.amlmapper.fpb.models;

import org.fpbjs.amlmapper.mapping.NodeKind;

import java.util.List;

/**
 * One process with its data and visual information.
 * Elements and flows share the "elementDataInformation" array in JSON; they are kept apart here,
 * each list in document order.
 */
public record ProcessEntry(
        FpbProcess process,
        List<FpbElement> elements,
        List<FpbFlow> flows,
        List<ElementVisual> elementVisuals,
        List<FlowVisual> flowVisuals
) {
    public FpbElement systemLimit() {
        return elements.stream()
                .filter(e -> e.kind() == NodeKind.SYSTEM_LIMIT)
                .findFirst()
                .orElse(null);
    }

    public FpbElement findElement(String id) {
        return elements.stream()
                .filter(e -> e.id().equals(id))
                .findFirst()
                .orElse(null);
    }

    public FpbFlow findFlow(String id) {
        return flows.stream()
                .filter(f -> f.id().equals(id))
                .findFirst()
                .orElse(null);
    }

    public ElementVisual findElementVisual(String id) {
        return elementVisuals.stream()
                .filter(v -> id.equals(v.id()))
                .findFirst()
                .orElse(null);
    }

    public FlowVisual findFlowVisual(String id) {
        return flowVisuals.stream()
                .filter(v -> id.equals(v.id()))
                .findFirst()
                .orElse(null);
    }
}
