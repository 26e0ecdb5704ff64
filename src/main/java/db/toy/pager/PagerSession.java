package db.toy.pager;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.toy.storage.StorageBackend;

/**
 * Owns the one authoritative {@link PagerState} of an open database and runs
 * actions against it. A run that completes replaces the state with the one the
 * action left behind; a run that throws leaves the state as it was.
 *
 * Single writer: not thread safe, and not meant to be shared.
 */
public final class PagerSession {
    private static final Logger LOG = LoggerFactory.getLogger(PagerSession.class);

    private final Pager pager;
    private PagerState state;

    public PagerSession(Pager pager, PagerState initialState) {
        this.pager = Objects.requireNonNull(pager, "pager");
        this.state = Objects.requireNonNull(initialState, "initialState");
    }

    /** Run a single action over a fresh pager on {@code backend}. */
    public static <T> SessionResult<T> runPager(PagerConf conf, PagerState state, StorageBackend backend,
                                                PagerAction<T> action) throws PagerException {
        return new PagerSession(new Pager(conf, backend), state).run(action);
    }

    public <T> SessionResult<T> run(PagerAction<T> action) throws PagerException {
        PagerTransaction tx = new PagerTransaction(pager, state);
        T result;
        PagerState finalState;
        boolean completed = false;
        try {
            result = action.run(tx);
            completed = true;
        } finally {
            finalState = tx.finish();
            if (!completed) LOG.debug("Session run failed, keeping state {}", state);
        }
        if (!finalState.equals(state)) {
            LOG.debug("Session state {} -> {}", state, finalState);
        }
        state = finalState;
        return new SessionResult<>(result, finalState);
    }

    public PagerState state() { return state; }

    public Pager pager() { return pager; }
}
