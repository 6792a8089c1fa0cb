package com.ai.concierge.conversation;

import com.ai.concierge.config.ConciergeProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Slot catalog. Guest bounds and valid cottage numbers come from configuration.
 */
@Component
public class SlotDefinitions {

    public static final String ANY_COTTAGE = "any";
    public static final Set<String> SEASONS = Set.of("weekday", "weekend", "peak", "off-peak");

    private final Map<SlotName, SlotDefinition> definitions = new EnumMap<>(SlotName.class);

    public SlotDefinitions(ConciergeProperties properties) {
        int maxGuests = properties.getDefaults().getMaxOccupancy();
        Set<String> cottages = properties.getCottages().keySet();
        Set<Intent> stayIntents = EnumSet.of(Intent.PRICING, Intent.BOOKING, Intent.AVAILABILITY, Intent.ROOMS);
        Set<Intent> datedIntents = EnumSet.of(Intent.PRICING, Intent.BOOKING, Intent.AVAILABILITY);

        add(new SlotDefinition(SlotName.GUESTS, SlotType.INTEGER, stayIntents, 1,
                v -> v instanceof Integer n && n >= 1 && n <= maxGuests));
        add(new SlotDefinition(SlotName.COTTAGE_ID, SlotType.ENUM, stayIntents, 2,
                v -> v instanceof String s && (cottages.contains(s) || ANY_COTTAGE.equals(s))));
        add(new SlotDefinition(SlotName.DATES, SlotType.DATE_RANGE, datedIntents, 3,
                v -> v instanceof DateRange r && r.nights() >= 1 && r.nights() <= 30));
        add(new SlotDefinition(SlotName.FAMILY, SlotType.BOOLEAN, EnumSet.of(Intent.BOOKING), 4,
                v -> v instanceof Boolean));
        add(new SlotDefinition(SlotName.NIGHTS, SlotType.INTEGER, EnumSet.of(Intent.PRICING, Intent.BOOKING), 4,
                v -> v instanceof Integer n && n > 0 && n <= 30));
        add(new SlotDefinition(SlotName.SEASON, SlotType.ENUM, EnumSet.of(Intent.PRICING), 5,
                v -> v instanceof String s && SEASONS.contains(s)));
        add(new SlotDefinition(SlotName.BUDGET, SlotType.INTEGER, EnumSet.noneOf(Intent.class), 6,
                v -> v instanceof Integer n && n > 0));
        add(new SlotDefinition(SlotName.PREFERENCES, SlotType.TEXT, EnumSet.noneOf(Intent.class), 7,
                v -> v instanceof String s && !s.isBlank()));
    }

    private void add(SlotDefinition definition) {
        definitions.put(definition.name(), definition);
    }

    public SlotDefinition get(SlotName name) {
        return definitions.get(name);
    }

    public Collection<SlotDefinition> all() {
        return Collections.unmodifiableCollection(definitions.values());
    }
}
