package org.fpbjs.amlmapper.mapping.models;

import org.fpbjs.amlmapper.mapping.FlowKind;
import org.fpbjs.amlmapper.mapping.PortDirection;

public record InterfaceInfo(FlowKind flowKind, PortDirection direction) {
}
