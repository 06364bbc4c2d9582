package org.fpbjs.amlmapper.fpb.models;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A complete FPB.JS document: the project header and all process entries.
 */
public record FpbDocument(
        FpbProject project,
        List<ProcessEntry> processes
) {
    public ProcessEntry findProcess(String processId) {
        if (processId == null) {
            return null;
        }
        return processes.stream()
                .filter(p -> processId.equals(p.process().id()))
                .findFirst()
                .orElse(null);
    }

    public ProcessEntry entryProcess() {
        return findProcess(project.entryPoint());
    }

    /**
     * Decomposition table of the document: decomposed process id to the id of the process operator it
     * refines. The entry process has no entry.
     */
    public Map<String, String> decompositionLinks() {
        Map<String, String> links = new LinkedHashMap<>();
        for (ProcessEntry entry : processes) {
            String operatorId = entry.process().isDecomposedProcessOperator();
            if (operatorId != null) {
                links.put(entry.process().id(), operatorId);
            }
        }
        return links;
    }
}
