package com.demo.soulbound.service.tx;

import com.demo.soulbound.service.error.InvalidStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.util.function.Supplier;

/**
 * Applies state-mutating operations one at a time, all or nothing.
 *
 * <p>A single monitor gives the total order. An operation that throws has its
 * journal rolled back; one that returns has its buffered events published.
 * Java monitors are reentrant, so a nested mutating call coming back on the
 * same thread (a treasury callback, an event listener running inside the
 * body) is detected through {@code current} and rejected.
 */
@Slf4j
public class OperationExecutor {

    private final ApplicationEventPublisher publisher;
    private StateJournal current;

    public OperationExecutor(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public synchronized <T> T execute(String operation, Supplier<T> body) {
        if (current != null) {
            throw new InvalidStateException(InvalidStateException.Reason.REENTRANT_CALL,
                    "Reentrant call to " + operation + " while " + current.operation() + " is executing");
        }
        StateJournal journal = new StateJournal(operation);
        current = journal;
        T result;
        try {
            result = body.get();
        } catch (RuntimeException | Error ex) {
            journal.rollback();
            log.debug("{} rejected: {}", operation, ex.getMessage());
            throw ex;
        } finally {
            current = null;
        }
        journal.events().forEach(publisher::publishEvent);
        return result;
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /** Reads take the same monitor so they never observe a half-applied operation from another thread. */
    public synchronized <T> T read(Supplier<T> query) {
        return query.get();
    }

    /** Journal of the executing operation; mutators must only be reached through {@link #execute}. */
    public synchronized StateJournal journal() {
        if (current == null) {
            throw new IllegalStateException("State mutation outside of an operation");
        }
        return current;
    }
}
