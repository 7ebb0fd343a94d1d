package org.lime.foodrecommender.retrieval;

import org.lime.foodrecommender.conversation.SlotSet;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.lime.foodrecommender.conversation.SlotSet.*;

/**
 * Converts accumulated slots into a search query. Pure: equal slot sets give equal queries,
 * and absent slots never produce a filter.
 */
@Component
public class QueryEnhancer {

    public static final String DEFAULT_TEXT = "food";
    public static final String ALL_DAY = "all_day";

    private static final Map<String, String> CUISINE_FAMILY = new HashMap<>();

    static {
        family("indian", "north indian", "south indian", "bengali", "punjabi", "mughlai", "hyderabadi",
                "lucknowi", "gujarati", "rajasthani", "maharashtrian", "kerala", "andhra", "chettinad");
        family("chinese", "asian", "pan-asian", "oriental");
        family("continental", "european");
        family("desserts", "sweets", "ice cream");
        family("seafood", "coastal");
        family("tandoor", "kebabs", "grill");
        family("middle eastern", "arabian", "lebanese", "turkish", "afghani");
        family("mediterranean", "greek");
        family("healthy food", "keto");
        family("mexican", "tex-mex");
    }

    private static void family(String name, String... members) {
        for (String member : members) {
            CUISINE_FAMILY.put(member, name);
        }
    }

    public Query buildQuery(SlotSet slots) {
        TreeMap<String, FilterConstraint> filters = new TreeMap<>();

        Integer min = slots.getInteger(PRICE_MIN);
        Integer max = slots.has(NO_PRICE_LIMIT) ? null : slots.getInteger(PRICE_MAX);
        if (min != null || max != null) {
            filters.put("price", FilterConstraint.range(min, max));
        }
        String dietary = slots.getString(DIETARY);
        if (dietary != null) {
            filters.put("dietary", FilterConstraint.equalTo(dietary));
        }
        String location = slots.getString(LOCATION);
        if (location != null) {
            filters.put("location", FilterConstraint.equalTo(location));
        }
        String meal = slots.getString(MEAL_TYPE);
        if (meal != null) {
            filters.put("meal_type", FilterConstraint.in(List.of(meal, ALL_DAY)));
        }
        return new Query(semanticText(slots), filters);
    }

    private static String semanticText(SlotSet slots) {
        Set<String> terms = new LinkedHashSet<>();
        Set<String> cuisines = new TreeSet<>(slots.getSet(CUISINE));
        terms.addAll(cuisines);
        for (String cuisine : cuisines) {
            String family = CUISINE_FAMILY.get(cuisine);
            if (family != null) {
                terms.add(family);
            }
        }
        addIfPresent(terms, slots.getString(DISH));
        String spice = slots.getString(SPICE);
        if (spice != null) {
            terms.add(spice.equals("high") ? "spicy" : spice + " spicy");
        }
        addIfPresent(terms, slots.getString(LABEL));
        if (terms.isEmpty()) {
            return DEFAULT_TEXT;
        }
        return String.join(" ", terms);
    }

    private static void addIfPresent(Set<String> terms, String value) {
        if (value != null && !value.isBlank()) {
            terms.add(value);
        }
    }
}
