package com.norma.orchestration.state;

import com.norma.orchestration.model.ScratchpadUpdate;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable facts gathered during a session. Keys only disappear through an explicit remove.
 */
public class Scratchpad {

    private final Map<String, Object> entries = new LinkedHashMap<>();

    void apply(ScratchpadUpdate update) {
        if (update == null || update.isEmpty()) {
            return;
        }
        update.set().forEach((key, value) -> {
            if (value != null) {
                entries.put(key, value);
            }
        });
        update.append().forEach((key, values) -> {
            List<Object> merged = new ArrayList<>();
            Object existing = entries.get(key);
            if (existing instanceof List<?> list) {
                merged.addAll(list);
            } else if (existing != null) {
                merged.add(existing);
            }
            for (Object value : values) {
                if (value != null && !merged.contains(value)) {
                    merged.add(value);
                }
            }
            entries.put(key, List.copyOf(merged));
        });
        update.remove().forEach(entries::remove);
    }

    @Nullable
    public Object get(String key) {
        return entries.get(key);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public List<String> getStrings(String key) {
        Object value = entries.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(item -> item != null).map(Object::toString).toList();
        }
        if (value != null) {
            return List.of(value.toString());
        }
        return List.of();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
