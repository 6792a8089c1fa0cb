package com.ai.concierge.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites slot maps saved before cottages were keyed by number: a
 * {@code room_type} of {@code "cottage_9"} becomes {@code cottage_id = "9"}.
 * Runs once when a session is loaded.
 */
public final class LegacySlotMigration {

    private static final Logger log = LoggerFactory.getLogger(LegacySlotMigration.class);

    static final String LEGACY_ROOM_TYPE = "room_type";
    private static final Pattern LEGACY_COTTAGE = Pattern.compile("^cottage[_\\s-]?(\\d+)$", Pattern.CASE_INSENSITIVE);

    private LegacySlotMigration() {
    }

    public static Map<String, Object> migrate(Map<String, Object> stored) {
        if (stored == null) return Map.of();
        if (!stored.containsKey(LEGACY_ROOM_TYPE)) return stored;

        Map<String, Object> migrated = new LinkedHashMap<>(stored);
        Object roomType = migrated.remove(LEGACY_ROOM_TYPE);
        if (roomType != null && !migrated.containsKey(SlotName.COTTAGE_ID.key())) {
            Matcher m = LEGACY_COTTAGE.matcher(roomType.toString().trim());
            if (m.matches()) {
                migrated.put(SlotName.COTTAGE_ID.key(), m.group(1));
            } else if ("any".equalsIgnoreCase(roomType.toString().trim())) {
                migrated.put(SlotName.COTTAGE_ID.key(), SlotDefinitions.ANY_COTTAGE);
            } else {
                log.warn("Dropping unrecognised legacy room_type '{}'", roomType);
            }
        }
        return migrated;
    }
}
