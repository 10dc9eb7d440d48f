package com.phillippitts.strategist.service.session;

import com.phillippitts.strategist.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of user sessions. Nothing survives a restart.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public SessionState create() {
        SessionState session = new SessionState(UUID.randomUUID().toString(), clock.instant());
        sessions.put(session.sessionId(), session);
        LOG.info("Session created: {}", session.sessionId());
        return session;
    }

    /**
     * @throws SessionNotFoundException if no session has that id
     */
    public SessionState get(String sessionId) {
        SessionState session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public int size() {
        return sessions.size();
    }
}
