package org.lime.foodrecommender.rerank;

import org.lime.foodrecommender.retrieval.CandidateItem;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of scoring rules a ranking condition may use. Every score lies in [0, 1].
 * The argument is the preference value the rule checks against; rules that do not need one ignore it.
 */
public enum ConditionEvaluator {

    SIMILARITY("similarity", "closeness to what you asked for") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            return clamp(item.similarityScore());
        }
    },
    PRICE_FIT("price_fit", "price within your budget") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            Double price = item.price();
            if (price == null) {
                return 0.5;
            }
            Integer min = context.priceMin();
            Integer max = context.priceMax();
            if (min != null && price < min) {
                return 0.5;
            }
            if (max == null) {
                return 1.0;
            }
            if (price > max) {
                return 0.0;
            }
            return clamp(1.0 - 0.5 * price / max);
        }
    },
    DIETARY_MATCH("dietary_match", "your dietary preference") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            if (argument == null) {
                return 1.0;
            }
            String dietary = lower(item.attribute("dietary"));
            if (argument.equals(dietary)) {
                return 1.0;
            }
            return "veg".equals(argument) && "vegan".equals(dietary) ? 1.0 : 0.0;
        }
    },
    RATING("rating", "strong ratings") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            Double rating = item.rating();
            return rating == null ? 0.5 : clamp(rating / 5.0);
        }
    },
    CUISINE_DIVERSITY("cuisine_diversity", "something different from recent picks") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            if (context.recentCuisines().isEmpty()) {
                return 1.0;
            }
            for (String cuisine : item.cuisines()) {
                if (context.recentCuisines().contains(lower(cuisine))) {
                    return 0.0;
                }
            }
            return 1.0;
        }
    },
    SPICE_MATCH("spice_match", "the spice level you wanted") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            if (argument == null) {
                return 1.0;
            }
            int wanted = SPICE_ORDER.indexOf(argument);
            int actual = SPICE_ORDER.indexOf(lower(item.attribute("spice")));
            if (wanted < 0 || actual < 0) {
                return 0.5;
            }
            int distance = Math.abs(wanted - actual);
            return distance == 0 ? 1.0 : distance == 1 ? 0.5 : 0.0;
        }
    },
    LABEL_MATCH("label_match", "its menu tag") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            if (argument == null) {
                return 1.0;
            }
            return argument.equals(lower(item.attribute("label"))) ? 1.0 : 0.0;
        }
    },
    NAME_MATCH("dish_name_match", "the dish you named") {
        @Override
        public double score(CandidateItem item, String argument, ScoringContext context) {
            if (argument == null || argument.isBlank()) {
                return 1.0;
            }
            String name = lower(item.name());
            String[] tokens = argument.trim().toLowerCase(Locale.ROOT).split("\\s+");
            int found = 0;
            for (String token : tokens) {
                if (name.contains(token)) {
                    found++;
                }
            }
            return (double) found / tokens.length;
        }
    };

    private static final List<String> SPICE_ORDER = List.of("mild", "medium", "high");

    private final String wireName;
    private final String phrase;

    ConditionEvaluator(String wireName, String phrase) {
        this.wireName = wireName;
        this.phrase = phrase;
    }

    public abstract double score(CandidateItem item, String argument, ScoringContext context);

    public String getWireName() {
        return wireName;
    }

    /**
     * Short noun phrase used in templated explanations.
     */
    public String getPhrase() {
        return phrase;
    }

    public static Optional<ConditionEvaluator> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConditionEvaluator evaluator : values()) {
            if (evaluator.wireName.equals(normalized)) {
                return Optional.of(evaluator);
            }
        }
        return Optional.empty();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
