package org.fpbjs.amlmapper.util;

/**
 * Source of identifiers for synthesized elements, flows, interfaces and links.
 * Identifiers only have to be unique within one document.
 */
@FunctionalInterface
public interface IdGenerator {
    String nextId();
}
