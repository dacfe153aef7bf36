package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Changes to apply to the scratchpad. {@code set} overwrites keys, {@code append} adds
 * values to list entries, and {@code remove} is the only way a key disappears.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ScratchpadUpdate(
        @JsonProperty("set") Map<String, Object> set,
        @JsonProperty("append") Map<String, List<Object>> append,
        @JsonProperty("remove") Set<String> remove
) {

    public static final ScratchpadUpdate EMPTY = new ScratchpadUpdate(Map.of(), Map.of(), Set.of());

    public ScratchpadUpdate {
        set = set == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(set));
        append = append == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(append));
        remove = remove == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(remove));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return set.isEmpty() && append.isEmpty() && remove.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Object> set = new LinkedHashMap<>();
        private final Map<String, List<Object>> append = new LinkedHashMap<>();
        private final Set<String> remove = new LinkedHashSet<>();

        public Builder set(String key, Object value) {
            set.put(key, value);
            return this;
        }

        public Builder setAll(Map<String, Object> values) {
            set.putAll(values);
            return this;
        }

        public Builder append(String key, Object value) {
            append.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder remove(String key) {
            remove.add(key);
            return this;
        }

        public ScratchpadUpdate build() {
            if (set.isEmpty() && append.isEmpty() && remove.isEmpty()) {
                return EMPTY;
            }
            Map<String, List<Object>> appended = new LinkedHashMap<>();
            append.forEach((key, values) -> appended.put(key, List.copyOf(values)));
            return new ScratchpadUpdate(set, appended, remove);
        }
    }
}
