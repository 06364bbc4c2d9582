package org.fpbjs.amlmapper.mapping;

/**
 * Direction of an ExternalInterface relative to the flow it belongs to.
 * SHARED marks interface classes used on both ends (FPD_Usage), whose direction
 * can only be taken from the side of the InternalLink they appear on.
 */
public enum PortDirection {
    IN,
    OUT,
    SHARED
}
