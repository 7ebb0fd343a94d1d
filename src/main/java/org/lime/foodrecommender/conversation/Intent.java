package org.lime.foodrecommender.conversation;

import java.util.Locale;
import java.util.Optional;

public enum Intent {
    GREETING("greeting", false),
    GOODBYE("goodbye", false),
    SPECIFY_PREFERENCE("specify_preference", true),
    UPDATE_PREFERENCE("update_preference", true),
    REQUEST_RECOMMENDATION("request_recommendation", true),
    CLARIFICATION_RESPONSE("clarification_response", true),
    UNKNOWN("unknown", false);

    private final String wireName;
    private final boolean slotBearing;

    Intent(String wireName, boolean slotBearing) {
        this.wireName = wireName;
        this.slotBearing = slotBearing;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Whether turns with this intent may carry preference values.
     */
    public boolean isSlotBearing() {
        return slotBearing;
    }

    public static Optional<Intent> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Intent intent : values()) {
            if (intent.wireName.equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
