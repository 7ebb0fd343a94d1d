package org.lime.foodrecommender.ai;

import org.lime.foodrecommender.config.FoodRecommenderProperties;
import org.lime.foodrecommender.conversation.Intent;
import org.lime.foodrecommender.conversation.SlotSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.lime.foodrecommender.conversation.SlotSet.*;

/**
 * Keyword and pattern rules used whenever the language model is unavailable or unsure.
 * Intent rules are evaluated in order and the first match wins.
 */
@Component
public class FallbackClassifier {

    private static final String CURRENCY = "(?:₹|\\brs\\.?|\\binr)?\\s*";

    private static final Pattern UPDATE_PATTERN = Pattern.compile(
            "\\b(instead|change|actually|rather|make it|switch|swap|no wait|not anymore)\\b");
    private static final Pattern RECOMMEND_PATTERN = Pattern.compile(
            "\\b(recommend|suggest|show me|looking for|find me|find|what should i|options|craving|hungry|i want|i'd like|want to (?:eat|order)|get me)\\b");
    private static final Pattern GOODBYE_PATTERN = Pattern.compile(
            "\\b(bye|goodbye|see you|quit|exit|thanks|thank you|that's all|that is all|done)\\b");
    private static final Pattern GREETING_PATTERN = Pattern.compile(
            "^\\s*(hi|hello|hey|hiya|namaste|good (?:morning|afternoon|evening))\\b");

    private static final Pattern PRICE_RANGE = Pattern.compile(
            "(?:between\\s+)?" + CURRENCY + "(\\d{2,5})\\s*(?:-|to|and)\\s*" + CURRENCY + "(\\d{2,5})");
    private static final Pattern PRICE_MAX_PATTERN = Pattern.compile(
            "\\b(?:under|below|less than|upto|up to|within|max|maximum|not more than|cheaper than|budget(?: of| is)?)\\s*"
                    + CURRENCY + "(\\d{2,5})");
    private static final Pattern PRICE_MIN_PATTERN = Pattern.compile(
            "\\b(?:above|over|more than|at least|minimum|starting from)\\s*" + CURRENCY + "(\\d{2,5})");
    private static final Pattern PRICE_BARE = Pattern.compile(
            "(?:₹|\\brs\\.?|\\binr)\\s*(\\d{2,5})|\\b(\\d{2,5})\\s*(?:rs|rupees|inr|bucks)\\b");

    private static final Pattern NONVEG_PATTERN = Pattern.compile(
            "\\bnon[- ]?veg(?:etarian)?\\b|\\b(chicken|mutton|lamb|fish|prawns?|egg|meat|beef|pork|keema)\\b");
    private static final Pattern VEGAN_PATTERN = Pattern.compile("\\bvegan\\b");
    private static final Pattern VEG_PATTERN = Pattern.compile("\\b(veg|vegetarian|veggie|paneer)\\b");

    private static final String[] NO_PRICE_LIMIT_PHRASES = {
            "no budget", "any budget", "any price", "no price limit", "no limit",
            "price doesn't matter", "price does not matter", "money is no object", "don't care about price",
            "budget is not an issue"
    };
    private static final String[] MILD_HINTS = {"mild", "not spicy", "less spicy", "non spicy", "no spice", "not too spicy"};
    private static final String[] MEDIUM_HINTS = {"medium spicy", "medium spice", "moderately spicy", "medium"};
    private static final String[] HIGH_HINTS = {"spicy", "extra spicy", "very spicy", "hot", "fiery"};
    private static final Map<String, String> MEAL_HINTS = new LinkedHashMap<>();
    private static final Map<String, String> LABEL_HINTS = new LinkedHashMap<>();

    static {
        MEAL_HINTS.put("breakfast", "breakfast");
        MEAL_HINTS.put("lunch", "lunch");
        MEAL_HINTS.put("dinner", "dinner");
        MEAL_HINTS.put("snacks", "snacks");
        MEAL_HINTS.put("snack", "snacks");

        LABEL_HINTS.put("best seller", "bestseller");
        LABEL_HINTS.put("bestseller", "bestseller");
        LABEL_HINTS.put("must try", "must try");
        LABEL_HINTS.put("chef's special", "chef's special");
        LABEL_HINTS.put("chefs special", "chef's special");
        LABEL_HINTS.put("seasonal", "seasonal");
        LABEL_HINTS.put("dairy free", "dairy free");
        LABEL_HINTS.put("gluten free", "gluten free");
        LABEL_HINTS.put("eggless", "eggless available");
    }

    private final List<String> dishes;
    private final List<String> cuisines;
    private final List<String> locations;

    public FallbackClassifier(FoodRecommenderProperties properties) {
        this.dishes = longestFirst(properties.getDialogue().getDishes());
        this.cuisines = longestFirst(properties.getDialogue().getCuisines());
        this.locations = longestFirst(properties.getDialogue().getLocations());
    }

    public Intent classify(String text, boolean clarificationPending) {
        String lower = lower(text);
        if (lower.isEmpty()) {
            return Intent.UNKNOWN;
        }
        if (UPDATE_PATTERN.matcher(lower).find()) {
            return Intent.UPDATE_PREFERENCE;
        }
        if (RECOMMEND_PATTERN.matcher(lower).find()) {
            return Intent.REQUEST_RECOMMENDATION;
        }
        boolean carriesSlots = !extractSlots(text).isEmpty();
        if (clarificationPending && carriesSlots) {
            return Intent.CLARIFICATION_RESPONSE;
        }
        if (carriesSlots) {
            return Intent.SPECIFY_PREFERENCE;
        }
        if (GOODBYE_PATTERN.matcher(lower).find()) {
            return Intent.GOODBYE;
        }
        if (GREETING_PATTERN.matcher(lower).find()) {
            return Intent.GREETING;
        }
        return Intent.UNKNOWN;
    }

    /**
     * Best-effort slot values from the text. Values are raw; the slot schema still validates them.
     */
    public Map<String, Object> extractSlots(String text) {
        Map<String, Object> slots = new LinkedHashMap<>();
        String lower = lower(text);
        if (lower.isEmpty()) {
            return slots;
        }
        String padded = " " + lower.replaceAll("[^a-z0-9' ]+", " ").replaceAll("\\s+", " ").trim() + " ";

        if (VEGAN_PATTERN.matcher(lower).find()) {
            slots.put(DIETARY, "vegan");
        } else if (NONVEG_PATTERN.matcher(lower).find()) {
            slots.put(DIETARY, "nonveg");
        } else if (VEG_PATTERN.matcher(lower).find()) {
            slots.put(DIETARY, "veg");
        }

        String dish = firstPhrase(padded, dishes);
        if (dish != null) {
            slots.put(DISH, dish);
        }
        List<String> foundCuisines = new ArrayList<>();
        String remaining = dish == null ? padded : padded.replace(" " + dish + " ", " ");
        for (String cuisine : cuisines) {
            if (foundCuisines.size() == SlotSchema.MAX_CUISINES) {
                break;
            }
            if (remaining.contains(" " + cuisine + " ")) {
                foundCuisines.add(cuisine);
                remaining = remaining.replace(" " + cuisine + " ", " ");
            }
        }
        if (!foundCuisines.isEmpty()) {
            slots.put(CUISINE, foundCuisines);
        }

        applyPrice(slots, lower);

        if (containsAny(lower, MILD_HINTS)) {
            slots.put(SPICE, "mild");
        } else if (containsAnyNormalized(padded, MEDIUM_HINTS)) {
            slots.put(SPICE, "medium");
        } else if (containsAnyNormalized(padded, HIGH_HINTS)) {
            slots.put(SPICE, "high");
        }

        MEAL_HINTS.forEach((hint, meal) -> {
            if (!slots.containsKey(MEAL_TYPE) && padded.contains(" " + hint + " ")) {
                slots.put(MEAL_TYPE, meal);
            }
        });
        LABEL_HINTS.forEach((hint, label) -> {
            if (!slots.containsKey(LABEL) && padded.contains(" " + hint + " ")) {
                slots.put(LABEL, label);
            }
        });
        String location = firstPhrase(padded, locations);
        if (location != null) {
            slots.put(LOCATION, location);
        }
        return slots;
    }

    private static void applyPrice(Map<String, Object> slots, String lower) {
        if (containsAny(lower, NO_PRICE_LIMIT_PHRASES)) {
            slots.put(NO_PRICE_LIMIT, Boolean.TRUE);
            return;
        }
        Matcher range = PRICE_RANGE.matcher(lower);
        if (range.find()) {
            int a = Integer.parseInt(range.group(1));
            int b = Integer.parseInt(range.group(2));
            slots.put(PRICE_MIN, Math.min(a, b));
            slots.put(PRICE_MAX, Math.max(a, b));
            return;
        }
        Matcher max = PRICE_MAX_PATTERN.matcher(lower);
        if (max.find()) {
            slots.put(PRICE_MAX, Integer.parseInt(max.group(1)));
        }
        Matcher min = PRICE_MIN_PATTERN.matcher(lower);
        if (min.find()) {
            slots.put(PRICE_MIN, Integer.parseInt(min.group(1)));
        }
        if (!slots.containsKey(PRICE_MAX) && !slots.containsKey(PRICE_MIN)) {
            Matcher bare = PRICE_BARE.matcher(lower);
            if (bare.find()) {
                String value = bare.group(1) != null ? bare.group(1) : bare.group(2);
                slots.put(PRICE_MAX, Integer.parseInt(value));
            }
        }
    }

    private static String firstPhrase(String padded, List<String> vocabulary) {
        for (String phrase : vocabulary) {
            if (padded.contains(" " + phrase + " ")) {
                return phrase;
            }
        }
        return null;
    }

    private static List<String> longestFirst(List<String> vocabulary) {
        List<String> sorted = new ArrayList<>();
        for (String entry : vocabulary) {
            sorted.add(entry.trim().toLowerCase(Locale.ROOT));
        }
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return List.copyOf(sorted);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
    }

    private static boolean containsAny(String text, String[] tokens) {
        for (String token : tokens) {
            if (text.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAnyNormalized(String padded, String[] tokens) {
        for (String token : tokens) {
            if (padded.contains(" " + token + " ")) {
                return true;
            }
        }
        return false;
    }
}
