package deskgate.core.model.admission;

import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

/**
 * Connectivity state of the shared counter store.
 *
 * <p>Owned and mutated by the store client only, from its connect, disconnect and
 * error callbacks. The admission controller reads it to decide whether to consult the
 * store at all.
 */
public final class StoreHealth {

    private static final Logger LOG = Logger.getLogger(StoreHealth.class);

    /**
     * Store connectivity states.
     */
    public enum State {
        /** Reachable and answering commands. */
        UP,
        /** Configured but unreachable or erroring. */
        DOWN,
        /** No connection URL configured. */
        UNCONFIGURED
    }

    private final String storeName;
    private final AtomicReference<State> state;

    public StoreHealth(String storeName, State initial) {
        this.storeName = storeName;
        this.state = new AtomicReference<>(initial);
    }

    public static StoreHealth up(String storeName) {
        return new StoreHealth(storeName, State.UP);
    }

    public static StoreHealth unconfigured(String storeName) {
        return new StoreHealth(storeName, State.UNCONFIGURED);
    }

    public State state() {
        return state.get();
    }

    public boolean isAvailable() {
        return state.get() == State.UP;
    }

    public void markUp() {
        transition(State.UP, null);
    }

    public void markDown(Throwable cause) {
        transition(State.DOWN, cause);
    }

    private void transition(State next, Throwable cause) {
        final var previous = state.getAndUpdate(current -> current == State.UNCONFIGURED ? current : next);
        if (previous == next || previous == State.UNCONFIGURED) {
            return;
        }
        if (next == State.UP) {
            LOG.infov("Counter store {0} is available", storeName);
        } else {
            LOG.warnv(
                    "Counter store {0} became unavailable, admission control fails open: {1}",
                    storeName, cause != null ? cause.getMessage() : "disconnected");
        }
    }
}
