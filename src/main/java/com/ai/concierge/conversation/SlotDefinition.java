package com.ai.concierge.conversation;

import java.util.Set;
import java.util.function.Predicate;

/**
 * How a slot is typed, validated and prioritised.
 *
 * @param requiredFor intents that cannot be answered precisely without this slot
 * @param priority    lower is asked first
 */
public record SlotDefinition(SlotName name,
                             SlotType type,
                             Set<Intent> requiredFor,
                             int priority,
                             Predicate<Object> validator) {

    public boolean isRequiredFor(Intent intent) {
        return requiredFor.contains(intent);
    }

    public boolean isValid(Object value) {
        return value != null && validator.test(value);
    }
}
