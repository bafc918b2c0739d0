package org.carball.stackops.model.resource;

/**
 * Anything the cloud lists. Identity is the resource id.
 */
public interface CloudResource {

    String getId();

    String getName();
}
