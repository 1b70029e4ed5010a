package com.parallax.core.agent;

import com.parallax.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table from {@link TaskKind} to its profile. Fails at construction
 * when a kind has no profile or two profiles claim the same kind.
 */
@Component
public class TaskKindRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskKindRegistry.class);

    private final Map<TaskKind, TaskKindProfile> profiles = new EnumMap<>(TaskKind.class);

    public TaskKindRegistry(List<TaskKindProfile> registered) {
        for (var profile : registered) {
            var previous = profiles.put(profile.kind(), profile);
            if (previous != null) {
                throw new IllegalStateException("Duplicate profile for task kind " + profile.kind() + ": "
                        + previous.getClass().getSimpleName() + " and " + profile.getClass().getSimpleName());
            }
        }
        for (var kind : TaskKind.values()) {
            if (!profiles.containsKey(kind)) {
                throw new IllegalStateException("No profile registered for task kind " + kind);
            }
        }
        log.info("Registered task kind profiles: {}", profiles.keySet());
    }

    public TaskKindProfile profileFor(TaskKind kind) {
        return profiles.get(kind);
    }

    public static TaskKindRegistry defaults() {
        return new TaskKindRegistry(List.of(new CodeTaskProfile(), new ResearchTaskProfile(), new AnalysisTaskProfile()));
    }
}
