package com.ai.concierge.conversation;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All mutable state for one conversation. Callers hold {@link #lock()} for the
 * whole read-modify-write of a turn.
 */
public class Session {

    private final String id;
    private final ChatHistory history;
    private final SlotManager slots;
    private final ContextTracker context;
    private final ReentrantLock lock = new ReentrantLock();
    private final Instant createdAt;

    public Session(String id, ChatHistory history, SlotManager slots, ContextTracker context, Instant createdAt) {
        this.id = id;
        this.history = history;
        this.slots = slots;
        this.context = context;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public ChatHistory getHistory() {
        return history;
    }

    public SlotManager getSlots() {
        return slots;
    }

    public ContextTracker getContext() {
        return context;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void reset() {
        history.clear();
        slots.clearSlots();
        context.clear();
    }
}
