package com.vigil.health;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only table of registered checks, in registration order.
 * <p>
 * Not thread-safe: confined to the coordinator thread.
 */
final class CheckTable {

    private final List<RegisteredCheck> checks = new ArrayList<>();
    private final Map<String, RegisteredCheck> byId = new HashMap<>();

    void add(RegisteredCheck check) {
        if (byId.putIfAbsent(check.id(), check) != null) {
            throw new DuplicateCheckException(check.id());
        }
        checks.add(check);
    }

    boolean contains(String id) {
        return byId.containsKey(id);
    }

    Optional<RegisteredCheck> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    List<RegisteredCheck> snapshot() {
        return List.copyOf(checks);
    }

    int size() {
        return checks.size();
    }
}
