package org.lime.foodrecommender.persona;

public interface PersonaDirectory {

    String personaFor(String userId);
}
