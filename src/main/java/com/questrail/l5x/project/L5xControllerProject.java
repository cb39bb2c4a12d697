package com.questrail.l5x.project;

import com.questrail.l5x.api.ControllerProject;
import com.questrail.l5x.api.ControllerTag;
import com.questrail.l5x.api.Routine;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable {@link ControllerProject} produced by {@link L5xProjectLoader}.
 */
final class L5xControllerProject implements ControllerProject
{
    private final String controllerName;
    private final List<Routine> routines;
    private final List<ControllerTag> tags;

    L5xControllerProject(String controllerName, List<Routine> routines, List<ControllerTag> tags) {
        this.controllerName = controllerName;
        this.routines = List.copyOf(Objects.requireNonNull(routines, "routines"));
        this.tags = List.copyOf(Objects.requireNonNull(tags, "tags"));
    }

    @Override
    public Optional<String> controllerName() {
        return Optional.ofNullable(controllerName);
    }

    @Override
    public List<Routine> routines() {
        return routines;
    }

    @Override
    public List<ControllerTag> tags() {
        return tags;
    }
}
