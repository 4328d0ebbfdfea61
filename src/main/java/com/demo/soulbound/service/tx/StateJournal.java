package com.demo.soulbound.service.tx;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Undo log and event buffer of the operation currently executing.
 * Every in-memory mutation registers its inverse here before it is applied.
 */
public class StateJournal {

    private final String operation;
    private final Deque<Runnable> undo = new ArrayDeque<>();
    private final List<Object> events = new ArrayList<>();

    StateJournal(String operation) {
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    public void onRollback(Runnable action) {
        undo.push(action);
    }

    public void emit(Object event) {
        events.add(event);
    }

    List<Object> events() {
        return Collections.unmodifiableList(events);
    }

    /** Replays undo actions newest first. */
    void rollback() {
        while (!undo.isEmpty()) {
            undo.pop().run();
        }
        events.clear();
    }
}
