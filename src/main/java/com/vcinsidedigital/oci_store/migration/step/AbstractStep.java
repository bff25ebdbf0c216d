package com.vcinsidedigital.oci_store.migration.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

abstract class AbstractStep<S extends AbstractStep<S>> implements MigrationStep {
    private final String id;
    private final List<String> dependsOn = new ArrayList<>();

    protected AbstractStep(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id must not be empty");
        }
        this.id = id;
    }

    /**
     * Declares that this step runs only after the given steps.
     */
    @SuppressWarnings("unchecked")
    public S after(MigrationStep... steps) {
        for (MigrationStep step : steps) {
            dependsOn.add(step.id());
        }
        return (S) this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<String> dependsOn() {
        return Collections.unmodifiableList(dependsOn);
    }

    @Override
    public String toString() {
        return id;
    }
}
