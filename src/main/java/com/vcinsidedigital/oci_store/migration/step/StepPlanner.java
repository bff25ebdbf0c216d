package com.vcinsidedigital.oci_store.migration.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Orders steps so that every step runs after the steps it depends on. Steps with no ordering
 * constraint between them keep their declaration order.
 */
public final class StepPlanner {
    private static final Logger logger = LoggerFactory.getLogger(StepPlanner.class);

    private StepPlanner() {
    }

    /**
     * @throws IllegalArgumentException on a duplicate step id, a dependency on an unknown step, or a cycle
     */
    public static List<MigrationStep> order(List<? extends MigrationStep> steps) {
        Map<String, MigrationStep> byId = new LinkedHashMap<>();
        for (MigrationStep step : steps) {
            if (byId.put(step.id(), step) != null) {
                throw new IllegalArgumentException("Duplicate step id: " + step.id());
            }
        }

        for (MigrationStep step : steps) {
            for (String dependency : step.dependsOn()) {
                if (!byId.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                            "Step '" + step.id() + "' depends on unknown step '" + dependency + "'");
                }
            }
        }

        List<MigrationStep> sorted = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> visiting = new ArrayDeque<>();

        for (MigrationStep step : steps) {
            topologicalSort(step, byId, visited, visiting, sorted);
        }

        logger.debug("Steps ordered by dependencies: {}", sorted.stream().map(MigrationStep::id).toList());
        return sorted;
    }

    private static void topologicalSort(MigrationStep step,
                                        Map<String, MigrationStep> byId,
                                        Set<String> visited,
                                        Deque<String> visiting,
                                        List<MigrationStep> sorted) {
        if (visited.contains(step.id())) {
            return;
        }

        if (visiting.contains(step.id())) {
            List<String> cycle = new ArrayList<>(visiting);
            Collections.reverse(cycle);
            cycle.add(step.id());
            throw new IllegalArgumentException("Circular step dependency: " + String.join(" -> ", cycle));
        }

        visiting.push(step.id());

        for (String dependency : step.dependsOn()) {
            topologicalSort(byId.get(dependency), byId, visited, visiting, sorted);
        }

        visiting.pop();
        visited.add(step.id());
        sorted.add(step);
    }
}
