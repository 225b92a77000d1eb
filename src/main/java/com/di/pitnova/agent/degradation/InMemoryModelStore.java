package com.di.pitnova.agent.degradation;

import com.di.pitnova.model.DegradationKey;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ModelStore}. Reads are lock-free so parallel validation can
 * share one store; writes are serialized. Tests create their own instance for isolation.
 */
@Component
public class InMemoryModelStore implements ModelStore {

    private final Map<DegradationKey, FittedDegradationModel> byKey = new ConcurrentHashMap<>();

    @Override
    public Optional<FittedDegradationModel> find(DegradationKey key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(key));
    }

    @Override
    public synchronized void put(FittedDegradationModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        byKey.put(model.getKey(), model);
    }

    @Override
    public synchronized boolean remove(DegradationKey key) {
        return key != null && byKey.remove(key) != null;
    }

    @Override
    public synchronized void replaceAll(Collection<FittedDegradationModel> models) {
        byKey.clear();
        if (models == null) return;
        for (FittedDegradationModel m : models) {
            if (m != null) byKey.put(m.getKey(), m);
        }
    }

    @Override
    public synchronized void reset() {
        byKey.clear();
    }

    @Override
    public List<DegradationKey> keys() {
        return byKey.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public Map<DegradationKey, FittedDegradationModel> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(byKey));
    }

    @Override
    public int size() {
        return byKey.size();
    }
}
