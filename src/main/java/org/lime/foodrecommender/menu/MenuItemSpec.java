package org.lime.foodrecommender.menu;

import org.lime.foodrecommender.retrieval.FilterConstraint;
import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

public class MenuItemSpec {

    private static final Map<String, String> ATTRIBUTES = Map.of(
            "price", "price",
            "dietary", "dietary",
            "location", "location",
            "meal_type", "mealType"
    );

    public static Specification<MenuItem> inShard(int shardId) {
        return (root, q, cb) -> cb.equal(root.get("shard"), shardId);
    }

    public static Specification<MenuItem> priceBetween(Integer min, Integer max) {
        return (root, q, cb) -> {
            if (min == null && max == null) return null;
            if (min != null && max != null) return cb.between(root.get("price"), min.doubleValue(), max.doubleValue());
            if (min != null) return cb.greaterThanOrEqualTo(root.get("price"), min.doubleValue());
            return cb.lessThanOrEqualTo(root.get("price"), max.doubleValue());
        };
    }

    public static Specification<MenuItem> attributeEquals(String attribute, String value) {
        return (root, q, cb) -> value == null ? null
                : cb.equal(cb.lower(root.get(attribute)), value.toLowerCase(Locale.ROOT));
    }

    public static Specification<MenuItem> attributeIn(String attribute, Collection<String> values) {
        return (root, q, cb) -> values == null || values.isEmpty() ? null
                : cb.lower(root.get(attribute)).in(values);
    }

    /**
     * Conjunction of every filter whose key maps to a catalog column; unknown keys are ignored.
     */
    public static Specification<MenuItem> matching(Map<String, FilterConstraint> filters) {
        Specification<MenuItem> spec = Specification.where(null);
        for (Map.Entry<String, FilterConstraint> entry : filters.entrySet()) {
            String attribute = ATTRIBUTES.get(entry.getKey());
            if (attribute == null) {
                continue;
            }
            FilterConstraint constraint = entry.getValue();
            Specification<MenuItem> next = switch (constraint.kind()) {
                case RANGE -> priceBetween(constraint.min(), constraint.max());
                case EQUALS -> attributeEquals(attribute, constraint.value());
                case IN -> attributeIn(attribute, constraint.values());
            };
            spec = spec.and(next);
        }
        return spec;
    }
}
