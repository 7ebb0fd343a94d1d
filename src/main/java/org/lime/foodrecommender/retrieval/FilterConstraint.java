package org.lime.foodrecommender.retrieval;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

public record FilterConstraint(Kind kind, String value, Integer min, Integer max, SortedSet<String> values) {

    public enum Kind {
        EQUALS,
        RANGE,
        IN
    }

    public static FilterConstraint equalTo(String value) {
        return new FilterConstraint(Kind.EQUALS, value, null, null, null);
    }

    public static FilterConstraint range(Integer min, Integer max) {
        return new FilterConstraint(Kind.RANGE, null, min, max, null);
    }

    public static FilterConstraint in(Collection<String> values) {
        return new FilterConstraint(Kind.IN, null, null, null, new TreeSet<>(values));
    }

    public FilterConstraint {
        if (values != null) {
            values = Collections.unmodifiableSortedSet(new TreeSet<>(values));
        }
    }

    public boolean matches(Object attribute) {
        if (attribute == null) {
            return false;
        }
        return switch (kind) {
            case EQUALS -> value.equalsIgnoreCase(String.valueOf(attribute));
            case IN -> values.contains(String.valueOf(attribute).toLowerCase(Locale.ROOT));
            case RANGE -> {
                if (!(attribute instanceof Number number)) {
                    yield false;
                }
                double v = number.doubleValue();
                yield (min == null || v >= min) && (max == null || v <= max);
            }
        };
    }
}
