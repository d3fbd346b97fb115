package org.asmdoc.model;

import org.asmdoc.api.SourceInfo;

/**
 * An entry recorded in a section of an {@link AssemblyFile}.
 */
public interface AssemblyItem {

    /**
     * Gets the location where the item starts.
     * @return The source location.
     */
    SourceInfo source();
}
