package org.fpbjs.amlmapper.fpb.models;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Process header of a process entry.
 * A decomposed process shares its id with the process operator it refines.
 */
@Builder
public record FpbProcess(
        String id,
        List<String> elementsContainer,
        String isDecomposedProcessOperator, // null for the entry process
        List<String> consistsOfStates,
        String consistsOfSystemLimit,
        List<String> consistsOfProcesses,
        List<String> consistsOfProcessOperator,
        String parent
) {
    public FpbProcess {
        if (elementsContainer == null) {
            elementsContainer = new ArrayList<>();
        }
        if (consistsOfStates == null) {
            consistsOfStates = new ArrayList<>();
        }
        if (consistsOfProcesses == null) {
            consistsOfProcesses = new ArrayList<>();
        }
        if (consistsOfProcessOperator == null) {
            consistsOfProcessOperator = new ArrayList<>();
        }
    }
}
