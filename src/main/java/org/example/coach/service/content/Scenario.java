package org.example.coach.service.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public record Scenario(
        String id,
        String title,
        String intro,
        String startNodeId,
        int reward,
        String badge,
        Map<String, ScenarioNode> nodes
) {
    public Scenario {
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public Optional<ScenarioNode> node(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(nodeId));
    }
}
