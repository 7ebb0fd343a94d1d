package org.lime.foodrecommender.conversation;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.lime.foodrecommender.conversation.SlotSet.*;

@Service
public class QuestionGenerationService {

    public String followUp(String requirement, SlotSet slots) {
        String question = switch (requirement == null ? "" : requirement) {
            case "dish_or_cuisine" -> "What are you in the mood for? Tell me a dish or a cuisine.";
            case "price" -> "What's your budget per dish? Say something like \"under 300\", or \"no limit\".";
            case "dietary" -> "Do you prefer veg, non-veg or vegan?";
            case "location" -> "Which city or area should I look in?";
            default -> "Could you tell me a bit more about what you'd like?";
        };
        String known = describeKnown(slots);
        return known == null ? question : "Got it, " + known + ". " + question;
    }

    public String greeting() {
        return "Hi! I can help you find something to eat. What are you craving today?";
    }

    public String farewell() {
        return "Enjoy your meal! Come back any time you're hungry.";
    }

    public String unclear() {
        return "Sorry, I didn't catch that. Try telling me a dish, a cuisine or your budget.";
    }

    public String retry() {
        return "I couldn't reach the menu just now. Please try again in a moment.";
    }

    public String noMatch(SlotSet slots) {
        String known = describeKnown(slots);
        String base = known == null
                ? "I couldn't find anything matching that."
                : "I couldn't find anything for " + known + ".";
        return base + " Try a higher budget or a different cuisine.";
    }

    public String recommendationHeadline(SlotSet slots, int count) {
        String known = describeKnown(slots);
        String noun = count == 1 ? "pick" : "picks";
        return known == null
                ? "Here are my top %d %s.".formatted(count, noun)
                : "Here are my top %d %s for %s.".formatted(count, noun, known);
    }

    static String describeKnown(SlotSet slots) {
        if (slots == null || slots.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        String spice = slots.getString(SPICE);
        if (spice != null) {
            parts.add(spice.equals("high") ? "spicy" : spice);
        }
        String dietary = slots.getString(DIETARY);
        if (dietary != null) {
            parts.add(dietary.equals("nonveg") ? "non-veg" : dietary);
        }
        Set<String> cuisines = slots.getSet(CUISINE);
        if (!cuisines.isEmpty()) {
            parts.add(String.join(" or ", cuisines));
        }
        String dish = slots.getString(DISH);
        if (dish != null) {
            parts.add(dish);
        }
        String budget = describeBudget(slots);
        if (budget != null) {
            parts.add(budget);
        }
        String meal = slots.getString(MEAL_TYPE);
        if (meal != null) {
            parts.add("for " + meal);
        }
        String location = slots.getString(LOCATION);
        if (location != null) {
            parts.add("in " + location);
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static String describeBudget(SlotSet slots) {
        if (slots.has(NO_PRICE_LIMIT)) {
            return "at any price";
        }
        Integer min = slots.getInteger(PRICE_MIN);
        Integer max = slots.getInteger(PRICE_MAX);
        if (min != null && max != null) {
            return "between ₹%d and ₹%d".formatted(min, max);
        }
        if (max != null) {
            return "under ₹%d".formatted(max);
        }
        if (min != null) {
            return "above ₹%d".formatted(min);
        }
        return null;
    }
}
