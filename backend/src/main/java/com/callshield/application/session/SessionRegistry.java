package com.callshield.application.session;

import com.callshield.application.session.exception.DuplicateSessionException;
import com.callshield.application.session.exception.UnknownSessionException;
import com.callshield.domain.session.model.CallSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Arena of live sessions indexed by session id. The map only hands out handles;
 * all session state is touched under the handle's own lock.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final ConcurrentMap<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    SessionHandle register(CallSession session) {
        SessionHandle handle = new SessionHandle(session);
        if (sessions.putIfAbsent(session.getSessionId(), handle) != null) {
            throw new DuplicateSessionException(session.getSessionId());
        }
        return handle;
    }

    SessionHandle require(String sessionId) {
        SessionHandle handle = sessionId == null ? null : sessions.get(sessionId);
        if (handle == null) {
            throw new UnknownSessionException(sessionId);
        }
        return handle;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Drop terminal sessions whose last activity is older than {@code cutoff}.
     * A session is kept while it has no stored evidence package, since a later submit re-assembles from it.
     * Sessions that are busy (lock held) are skipped until the next run.
     *
     * @return number of sessions evicted
     */
    public int evictTerminated(Instant cutoff) {
        int evicted = 0;
        Iterator<Map.Entry<String, SessionHandle>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            SessionHandle handle = it.next().getValue();
            if (!handle.getLock().tryLock()) {
                continue;
            }
            try {
                var session = handle.getSession();
                if (session.getState().isTerminal() && session.hasEvidence() && !handle.isSubmitting()
                        && session.getLastActivityAt().isBefore(cutoff)) {
                    it.remove();
                    evicted++;
                    log.debug("Archived session {} in state {}", session.getSessionId(), session.getState());
                }
            } finally {
                handle.getLock().unlock();
            }
        }
        return evicted;
    }
}
