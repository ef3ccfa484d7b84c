package org.example.webverse.service.host;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class StageRegistry {

    private final Map<String, Stage> stages = new LinkedHashMap<>();

    public StageRegistry(List<Stage> stages) {
        for (Stage stage : stages) {
            Stage previous = this.stages.put(stage.name(), stage);
            if (previous != null) {
                throw new IllegalStateException("Duplicate stage name: " + stage.name());
            }
        }
    }

    public Optional<Stage> find(String name) {
        return Optional.ofNullable(name == null ? null : stages.get(name));
    }

    public Set<String> names() {
        return stages.keySet();
    }
}
