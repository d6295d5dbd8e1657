package com.meritmarket.gateway;

import com.meritmarket.config.ResolutionRuntimeProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        prefix = "resolution.collaborators",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryLegislatorRoster implements LegislatorRoster {

    private final ResolutionRuntimeProperties properties;
    private final Map<String, Long> weights = new ConcurrentHashMap<>();

    @PostConstruct
    void seedRoster() {
        properties.getInMemory().getLegislators().forEach(this::elect);
    }

    public void elect(String identity, long weight) {
        weights.put(identity, weight);
    }

    public void remove(String identity) {
        weights.remove(identity);
    }

    @Override
    public boolean isLegislator(String identity) {
        return identity != null && weights.containsKey(identity);
    }

    @Override
    public long votingWeight(String identity) {
        return identity == null ? 0L : weights.getOrDefault(identity, 0L);
    }

    @Override
    public List<String> legislators() {
        List<String> roster = new ArrayList<>(weights.keySet());
        roster.sort(String::compareTo);
        return roster;
    }
}
