package org.lime.foodrecommender.conversation;

import java.time.Instant;
import java.util.Locale;

public record Turn(Speaker speaker, String text, Instant timestamp, Intent detectedIntent) {

    public static Turn user(String text, Intent intent) {
        return new Turn(Speaker.USER, text, Instant.now(), intent);
    }

    public static Turn system(String text) {
        return new Turn(Speaker.SYSTEM, text, Instant.now(), null);
    }

    /**
     * One line per turn, used as model context.
     */
    public String asContextLine() {
        return speaker.name().toLowerCase(Locale.ROOT) + ": " + text;
    }
}
