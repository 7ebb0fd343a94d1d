package org.lime.foodrecommender.conversation;

import lombok.extern.slf4j.Slf4j;
import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.lime.foodrecommender.conversation.SlotSet.*;

/**
 * Static description of every slot: which values are allowed and how a new value combines
 * with the one already held. Anything that fails validation never reaches a {@link SlotSet}.
 */
@Slf4j
@Component
public class SlotSchema {

    public static final int MAX_CUISINES = 2;
    public static final List<String> MEAL_TYPES = List.of("breakfast", "lunch", "dinner", "snacks");
    public static final List<String> LABELS = List.of(
            "bestseller", "must try", "chef's special", "new", "seasonal",
            "dairy free", "gluten free", "eggless available"
    );

    private static final Map<String, MergePolicy> POLICIES = new LinkedHashMap<>();

    static {
        POLICIES.put(DIETARY, MergePolicy.REPLACE);
        POLICIES.put(CUISINE, MergePolicy.UNION);
        POLICIES.put(DISH, MergePolicy.REPLACE);
        POLICIES.put(PRICE_MAX, MergePolicy.REPLACE);
        POLICIES.put(PRICE_MIN, MergePolicy.REPLACE);
        POLICIES.put(NO_PRICE_LIMIT, MergePolicy.REPLACE);
        POLICIES.put(LOCATION, MergePolicy.REPLACE);
        POLICIES.put(MEAL_TYPE, MergePolicy.REPLACE);
        POLICIES.put(SPICE, MergePolicy.REPLACE);
        POLICIES.put(LABEL, MergePolicy.REPLACE);
    }

    private final Set<String> cuisines;

    public SlotSchema(FoodRecommenderProperties properties) {
        this.cuisines = new LinkedHashSet<>();
        for (String cuisine : properties.getDialogue().getCuisines()) {
            cuisines.add(cuisine.trim().toLowerCase(Locale.ROOT));
        }
    }

    public MergePolicy policy(String slot) {
        return POLICIES.get(slot);
    }

    /**
     * Normalizes a raw value for the slot, or returns empty when it is outside the schema.
     */
    public Optional<Object> validate(String slot, Object raw) {
        if (raw == null || !POLICIES.containsKey(slot)) {
            return Optional.empty();
        }
        return Optional.ofNullable(switch (slot) {
            case DIETARY -> dietary(raw);
            case CUISINE -> cuisineSet(raw);
            case DISH -> text(raw, 2, 60);
            case PRICE_MAX -> integer(raw, 50, 5000);
            case PRICE_MIN -> integer(raw, 0, 5000);
            case NO_PRICE_LIMIT -> Boolean.TRUE.equals(raw) || "true".equalsIgnoreCase(String.valueOf(raw).trim())
                    ? Boolean.TRUE : null;
            case LOCATION -> text(raw, 2, 40);
            case MEAL_TYPE -> mealType(raw);
            case SPICE -> spice(raw);
            case LABEL -> oneOf(raw, LABELS);
            default -> null;
        });
    }

    /**
     * Validates and merges raw values in iteration order. Null entries count as "not mentioned".
     */
    public MergeReport mergeInto(SlotSet slots, Map<String, ?> raw) {
        List<String> applied = new ArrayList<>();
        List<String> discarded = new ArrayList<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String slot = entry.getKey();
            if (entry.getValue() == null) {
                continue;
            }
            Optional<Object> value = validate(slot, entry.getValue());
            if (value.isEmpty()) {
                log.info("Discarding slot value {}={} outside schema", slot, entry.getValue());
                discarded.add(slot);
                continue;
            }
            apply(slots, slot, value.get());
            applied.add(slot);
        }
        Integer min = slots.getInteger(PRICE_MIN);
        Integer max = slots.getInteger(PRICE_MAX);
        if (min != null && max != null && min > max) {
            slots.remove(PRICE_MIN);
        }
        return new MergeReport(applied, discarded);
    }

    private void apply(SlotSet slots, String slot, Object value) {
        if (policy(slot) == MergePolicy.UNION) {
            Set<String> incoming = value instanceof Set<?> set
                    ? set.stream().map(String::valueOf).collect(Collectors.toCollection(LinkedHashSet::new))
                    : Set.of(String.valueOf(value));
            LinkedHashSet<String> merged = new LinkedHashSet<>(slots.getSet(slot));
            merged.removeAll(incoming);
            merged.addAll(incoming);
            while (merged.size() > MAX_CUISINES) {
                merged.remove(merged.iterator().next());
            }
            slots.put(slot, merged);
            return;
        }
        slots.put(slot, value);
        if (PRICE_MAX.equals(slot)) {
            slots.remove(NO_PRICE_LIMIT);
        } else if (NO_PRICE_LIMIT.equals(slot)) {
            slots.remove(PRICE_MAX);
        }
    }

    private static String dietary(Object raw) {
        String cleaned = String.valueOf(raw).toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        return switch (cleaned) {
            case "veg", "vegetarian", "veggie" -> "veg";
            case "nonveg", "nonvegetarian" -> "nonveg";
            case "vegan" -> "vegan";
            default -> null;
        };
    }

    private Set<String> cuisineSet(Object raw) {
        Collection<?> candidates = raw instanceof Collection<?> c ? c : List.of(raw);
        LinkedHashSet<String> valid = new LinkedHashSet<>();
        for (Object candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            String normalized = String.valueOf(candidate).trim().toLowerCase(Locale.ROOT);
            if (cuisines.contains(normalized)) {
                valid.add(normalized);
            }
        }
        return valid.isEmpty() ? null : valid;
    }

    private static String text(Object raw, int minLength, int maxLength) {
        if (!(raw instanceof String s)) {
            return null;
        }
        String normalized = s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return normalized.length() >= minLength && normalized.length() <= maxLength ? normalized : null;
    }

    private static Integer integer(Object raw, int min, int max) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else {
            try {
                value = Double.parseDouble(String.valueOf(raw).toLowerCase(Locale.ROOT).replaceAll("[₹,\\s]|rs\\.?", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (Double.isNaN(value) || value < min || value > max) {
            return null;
        }
        return (int) Math.round(value);
    }

    private static String mealType(Object raw) {
        String normalized = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        if ("snack".equals(normalized)) {
            return "snacks";
        }
        return MEAL_TYPES.contains(normalized) ? normalized : null;
    }

    private static String spice(Object raw) {
        String normalized = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "mild", "low", "less" -> "mild";
            case "medium", "moderate" -> "medium";
            case "high", "hot", "spicy", "extra spicy" -> "high";
            default -> null;
        };
    }

    private static String oneOf(Object raw, List<String> allowed) {
        String normalized = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        return allowed.contains(normalized) ? normalized : null;
    }
}
