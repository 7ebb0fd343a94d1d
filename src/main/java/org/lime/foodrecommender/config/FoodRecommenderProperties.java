package org.lime.foodrecommender.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "foodrec")
@Data
public class FoodRecommenderProperties {

    private Gateway gateway = new Gateway();
    private Dialogue dialogue = new Dialogue();
    private Sufficiency sufficiency = new Sufficiency();
    private Retrieval retrieval = new Retrieval();
    private Rerank rerank = new Rerank();
    private Session session = new Session();
    private Persona persona = new Persona();
    private Cache cache = new Cache();

    @Data
    public static class Gateway {
        private Duration timeout = Duration.ofSeconds(3);
        private int maxAttempts = 2;
        private Duration retryBackoff = Duration.ofMillis(100);
        private int threads = 8;
        private RateLimit rateLimit = new RateLimit();
    }

    @Data
    public static class RateLimit {
        private int limitForPeriod = 20;
        private Duration refreshPeriod = Duration.ofSeconds(1);
        private Duration permitWait = Duration.ofSeconds(2);
    }

    @Data
    public static class Dialogue {
        private int historyWindow = 6;
        private double minIntentConfidence = 0.5;
        private List<String> cuisines = new ArrayList<>(List.of(
                "indian", "north indian", "south indian", "chinese", "italian", "thai", "mexican",
                "japanese", "korean", "continental", "american", "mughlai", "hyderabadi", "punjabi",
                "bengali", "street food", "fast food", "desserts", "bakery", "beverages", "biryani",
                "pizzas", "burgers", "salads", "seafood", "healthy food", "middle eastern", "tandoor"
        ));
        private List<String> dishes = new ArrayList<>(List.of(
                "biryani", "pizza", "burger", "dosa", "idli", "paneer tikka", "butter chicken", "noodles",
                "fried rice", "momos", "pasta", "sandwich", "wrap", "thali", "kebab", "shawarma", "tacos",
                "sushi", "ramen", "ice cream", "cake", "salad", "curry", "dal makhani", "chole bhature"
        ));
        private List<String> locations = new ArrayList<>(List.of(
                "bangalore", "mumbai", "delhi", "hyderabad", "chennai", "pune", "kolkata"
        ));
    }

    @Data
    public static class Sufficiency {
        private List<Requirement> requirements = new ArrayList<>(List.of(
                new Requirement("dish_or_cuisine", List.of("dish", "cuisine")),
                new Requirement("price", List.of("price_max", "no_price_limit"))
        ));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Requirement {
        private String name;
        private List<String> anyOf = new ArrayList<>();
    }

    @Data
    public static class Retrieval {
        private List<Integer> shards = new ArrayList<>(List.of(0, 1, 2, 3));
        private int topNPerShard = 20;
        private int candidateCap = 50;
        private Duration shardTimeout = Duration.ofSeconds(2);
        private Duration turnTimeout = Duration.ofSeconds(6);
        private int threads = 8;
    }

    @Data
    public static class Rerank {
        private int topK = 10;
        private int historyCycles = 3;
        private boolean generativeConditions = false;
        private boolean generativeExplanations = true;
        private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
                "similarity", 0.35,
                "price_fit", 0.2,
                "dietary_match", 0.2,
                "rating", 0.1,
                "cuisine_diversity", 0.1,
                "spice_match", 0.1,
                "label_match", 0.1,
                "dish_name_match", 0.15
        ));
        private Map<String, Map<String, Double>> personaMultipliers = new HashMap<>();
    }

    @Data
    public static class Session {
        private Duration idleTimeout = Duration.ofMinutes(30);
        private int searchHistoryLimit = 50;
    }

    @Data
    public static class Cache {
        private long queryEmbeddingMaxSize = 1_000;
        private long itemEmbeddingMaxSize = 10_000;
        private long metadataMaxSize = 5_000;
        private Duration expireAfterWrite = Duration.ofHours(1);
    }

    @Data
    public static class Persona {
        private String defaultPersona = "general";
        private Map<String, String> assignments = new HashMap<>();
    }
}
