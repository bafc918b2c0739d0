package org.carball.stackops.model.property;

/**
 * Value kind a property declares. Decides which preset kinds may be applied to it.
 */
public enum PropertyKind {
    STRING,
    INTEGER,
    DATETIME,
    BOOLEAN
}
