package org.fpbjs.amlmapper.aml;

import java.util.HashMap;
import java.util.Map;

/**
 * Naming convention for repeated CAEX names: the first occurrence keeps the bare base name, later ones get
 * a numeric suffix starting at 1 (FPD_FlowOut, FPD_FlowOut1, FPD_FlowOut2, ...).
 * Interfaces, waypoints, characteristics and links all follow it, and waypoint order is recovered from it.
 */
public class AmlNaming {

    public static String indexedName(String baseName, int index) {
        return index == 0 ? baseName : baseName + index;
    }

    /**
     * Inverse of {@link #indexedName(String, int)}.
     *
     * @return the index encoded in the name, or null if the name does not start with the base name or the
     * suffix is not a non-negative integer
     */
    public static Integer indexOf(String name, String baseName) {
        if (name == null || !name.startsWith(baseName)) {
            return null;
        }
        String suffix = name.substring(baseName.length());
        if (suffix.isEmpty()) {
            return 0;
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return null;
            }
        }
        try {
            return Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return null;
        }
    }

    /**
     * Hands out indexed names per owner and base name. One instance is used per process.
     */
    public static class Counter {
        private final Map<String, Map<String, Integer>> countsByOwner = new HashMap<>();

        public String next(String ownerId, String baseName) {
            Map<String, Integer> counts = countsByOwner.computeIfAbsent(ownerId, k -> new HashMap<>());
            int count = counts.getOrDefault(baseName, 0);
            counts.put(baseName, count + 1);
            return indexedName(baseName, count);
        }
    }
}
