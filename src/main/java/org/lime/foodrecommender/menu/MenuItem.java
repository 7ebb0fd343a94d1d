package org.lime.foodrecommender.menu;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity @Table(name="menu_item")
@Data @NoArgsConstructor @AllArgsConstructor @Builder
public class MenuItem {
    @Id
    private Long id;
    private String name;
    private String restaurant;
    private Double price;        // INR
    private String dietary;      // veg | nonveg | vegan
    private String cuisine;
    @Column(name="secondary_cuisine")
    private String secondaryCuisine;
    private Double rating;       // 0..5
    private String label;
    @Column(name="spice_level")
    private String spiceLevel;   // mild | medium | high
    @Column(name="meal_type")
    private String mealType;     // breakfast | lunch | dinner | snacks | all_day
    private String location;
    @Column(name="shard_id")
    private Integer shard;
    @Column(length=1000)
    private String description;

    public String itemId() {
        return String.valueOf(id);
    }

    public List<String> cuisines() {
        List<String> cuisines = new ArrayList<>(2);
        if (cuisine != null) {
            cuisines.add(cuisine);
        }
        if (secondaryCuisine != null) {
            cuisines.add(secondaryCuisine);
        }
        return cuisines;
    }

    /**
     * Flat attribute map carried alongside search hits.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", name);
        metadata.put("restaurant", restaurant);
        metadata.put("price", price);
        metadata.put("dietary", dietary);
        metadata.put("cuisines", cuisines());
        metadata.put("rating", rating);
        metadata.put("label", label);
        metadata.put("spice", spiceLevel);
        metadata.put("meal_type", mealType);
        metadata.put("location", location);
        return metadata;
    }
}
