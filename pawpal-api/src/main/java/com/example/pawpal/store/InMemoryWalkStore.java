package com.example.pawpal.store;

import com.example.pawpal.model.Walk;
import com.example.pawpal.model.WalkStatus;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class InMemoryWalkStore {

    private final ConcurrentHashMap<String, Walk> walks = new ConcurrentHashMap<>();
    private final AtomicInteger idSequence = new AtomicInteger(1);

    public String nextId() {
        String id;
        do {
            id = "WALK-%03d".formatted(idSequence.getAndIncrement());
        } while (walks.containsKey(id));
        return id;
    }

    public void save(Walk walk) {
        walks.put(walk.getWalkId(), walk);
    }

    public boolean exists(String walkId) {
        return walkId != null && walks.containsKey(walkId);
    }

    public Optional<Walk> findById(String walkId) {
        return walkId == null ? Optional.empty() : Optional.ofNullable(walks.get(walkId));
    }

    public long countByStatus(WalkStatus status) {
        return walks.values().stream()
                .filter(w -> w.getStatus() == status)
                .count();
    }
}
