package org.lime.foodrecommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FoodRecommenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoodRecommenderApplication.class, args);
    }
}
