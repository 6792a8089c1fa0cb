package com.ai.concierge.component;

import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.ChatHistory;
import com.ai.concierge.conversation.ContextTracker;
import com.ai.concierge.conversation.DateRange;
import com.ai.concierge.conversation.LegacySlotMigration;
import com.ai.concierge.conversation.Session;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotManager;
import com.ai.concierge.conversation.SlotName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns every live {@link Session}, keyed by session id. Sessions are created on
 * first use and live until cleared or deleted.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final SlotDefinitions slotDefinitions;
    private final ConciergeProperties properties;
    private final Clock clock;

    public SessionRegistry(SlotDefinitions slotDefinitions, ConciergeProperties properties, Clock clock) {
        this.slotDefinitions = slotDefinitions;
        this.properties = properties;
        this.clock = clock;
    }

    public Session getOrCreate(String sessionId) {
        return sessions.computeIfAbsent(sessionId, this::newSession);
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Runs {@code work} while holding the session lock. A session deleted while
     * this call waited for its lock is not used; the turn runs on a fresh one.
     */
    public <T> T withSession(String sessionId, Function<Session, T> work) {
        while (true) {
            Session session = getOrCreate(sessionId);
            session.lock().lock();
            try {
                if (sessions.get(sessionId) == session) {
                    return work.apply(session);
                }
                log.debug("[{}] Session was deleted while waiting, starting over", sessionId);
            } finally {
                session.lock().unlock();
            }
        }
    }

    /** Empties history, slots and context but keeps the session. */
    public boolean clear(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) return false;
        session.lock().lock();
        try {
            session.reset();
        } finally {
            session.lock().unlock();
        }
        log.info("[{}] Session cleared", sessionId);
        return true;
    }

    /** Removes the session once any running turn on it has finished. */
    public boolean delete(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) return false;
        boolean removed;
        session.lock().lock();
        try {
            removed = sessions.remove(sessionId, session);
        } finally {
            session.lock().unlock();
        }
        if (removed) log.info("[{}] Session deleted", sessionId);
        return removed;
    }

    /**
     * Loads previously saved slots into a session. Legacy keys are migrated
     * first; values that fail validation are dropped.
     */
    public Session restore(String sessionId, Map<String, Object> storedSlots) {
        Map<String, Object> migrated = LegacySlotMigration.migrate(storedSlots);
        Map<SlotName, Object> typed = new EnumMap<>(SlotName.class);
        migrated.forEach((key, value) -> SlotName.fromKey(key)
                .ifPresentOrElse(
                        name -> toSlotValue(name, value).ifPresent(v -> typed.put(name, v)),
                        () -> log.warn("[{}] Ignoring unknown stored slot '{}'", sessionId, key)));
        return withSession(sessionId, session -> {
            session.getSlots().updateSlots(typed);
            log.info("[{}] Restored slots {}", sessionId, session.getSlots().toKeyMap().keySet());
            return session;
        });
    }

    public int size() {
        return sessions.size();
    }

    private Session newSession(String sessionId) {
        log.info("[{}] New session", sessionId);
        return new Session(sessionId,
                new ChatHistory(properties.getSession().getHistoryLength()),
                new SlotManager(slotDefinitions),
                new ContextTracker(),
                clock.instant());
    }

    private Optional<Object> toSlotValue(SlotName name, Object value) {
        if (value == null) return Optional.empty();
        switch (name) {
            case GUESTS, NIGHTS, BUDGET:
                if (value instanceof Number n) return Optional.of(n.intValue());
                return parseInt(value.toString()).map(Object.class::cast);
            case FAMILY:
                if (value instanceof Boolean b) return Optional.of(b);
                return Optional.of(Boolean.parseBoolean(value.toString()));
            case DATES:
                if (value instanceof DateRange r) return Optional.of(r);
                if (value instanceof Map<?, ?> map && map.get("start") != null && map.get("end") != null) {
                    try {
                        return Optional.of(DateRange.of(
                                LocalDate.parse(map.get("start").toString()),
                                LocalDate.parse(map.get("end").toString())));
                    } catch (DateTimeParseException e) {
                        log.warn("Stored date range {} could not be parsed", map, e);
                    }
                }
                return Optional.empty();
            default:
                return Optional.of(value.toString());
        }
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
