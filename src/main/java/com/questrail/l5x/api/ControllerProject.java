package com.questrail.l5x.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ControllerProject
 * -----------------------------------------------------------------------------
 * Read-only structured view of a controller-program export.
 *
 * <p>This is the document-provider boundary of the pipeline. Everything past
 * this interface works on {@link Routine}, {@link RungRecord} and
 * {@link ControllerTag} and never sees the container format.</p>
 *
 * <p>Implementations must return routines and tags in document order. That
 * ordering is what makes "first match wins" searches reproducible.</p>
 */
public interface ControllerProject
{
    /**
     * Returns the controller name, if the export declares one.
     */
    Optional<String> controllerName();

    /**
     * Returns every ladder routine of every program, programs first, then
     * routines within each program, both in document order.
     */
    List<Routine> routines();

    /**
     * Returns the controller-scope tag table in document order.
     */
    List<ControllerTag> tags();

    /**
     * Looks up a controller-scope tag by exact name.
     */
    default Optional<ControllerTag> tag(String name) {
        Objects.requireNonNull(name, "name");
        for (ControllerTag tag : tags()) {
            if (tag.name().equals(name)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
