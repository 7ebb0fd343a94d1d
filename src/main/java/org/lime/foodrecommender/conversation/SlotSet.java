package org.lime.foodrecommender.conversation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public class SlotSet {

    public static final String DIETARY = "dietary";
    public static final String CUISINE = "cuisine";
    public static final String DISH = "dish";
    public static final String PRICE_MAX = "price_max";
    public static final String PRICE_MIN = "price_min";
    public static final String NO_PRICE_LIMIT = "no_price_limit";
    public static final String LOCATION = "location";
    public static final String MEAL_TYPE = "meal_type";
    public static final String SPICE = "spice";
    public static final String LABEL = "label";

    private final Map<String, Object> values = new LinkedHashMap<>();

    public boolean has(String slot) {
        return values.containsKey(slot);
    }

    public Object get(String slot) {
        return values.get(slot);
    }

    public String getString(String slot) {
        Object value = values.get(slot);
        return value instanceof String s ? s : null;
    }

    public Integer getInteger(String slot) {
        Object value = values.get(slot);
        return value instanceof Integer i ? i : null;
    }

    public Set<String> getSet(String slot) {
        Object value = values.get(slot);
        if (value instanceof Set<?> set) {
            return Collections.unmodifiableSet(set.stream()
                    .map(String::valueOf)
                    .collect(Collectors.<String, LinkedHashSet<String>>toCollection(LinkedHashSet::new)));
        }
        return Set.of();
    }

    public void put(String slot, Object value) {
        values.put(slot, value);
    }

    public void remove(String slot) {
        values.remove(slot);
    }

    public void clear() {
        values.clear();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public SlotSet copy() {
        SlotSet copy = new SlotSet();
        values.forEach((slot, value) -> copy.values.put(slot,
                value instanceof Set<?> set ? new LinkedHashSet<>(set) : value));
        return copy;
    }

    public void replaceWith(SlotSet other) {
        values.clear();
        values.putAll(other.copy().values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotSet other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
