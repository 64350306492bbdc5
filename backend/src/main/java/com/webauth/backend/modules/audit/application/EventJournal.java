package com.webauth.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.webauth.backend.modules.audit.domain.AuthEvent;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.audit.infrastructure.AuthEventRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only journal of authentication decisions. Messages must never carry credentials.
 */
@Service
public class EventJournal {

    private static final Logger log = LoggerFactory.getLogger(EventJournal.class);

    private final ObjectProvider<AuthEventRepository> authEventRepositoryProvider;
    private final Clock clock;

    public EventJournal(ObjectProvider<AuthEventRepository> authEventRepositoryProvider, Clock clock) {
        this.authEventRepositoryProvider = authEventRepositoryProvider;
        this.clock = clock;
    }

    @Transactional
    public void write(EventName name, boolean success, String username, String message) {
        AuthEventRepository authEventRepository = store();
        AuthEvent event = new AuthEvent();
        event.setName(name);
        event.setSuccess(success);
        event.setUsername(username != null ? username : "");
        event.setMessage(truncate(message));
        event.setCreated(OffsetDateTime.now(clock));
        try {
            authEventRepository.save(event);
        } catch (DataAccessException ex) {
            throw new EventJournalException(EventJournalException.WRITE_EVENT_FAILED, "failed to write event " + name.value(), ex);
        }
    }

    /**
     * Best-effort variant for request handlers: a lost audit row is logged, never surfaced to the user.
     */
    public void tryWrite(EventName name, boolean success, String username, String message) {
        try {
            write(name, success, username, message);
        } catch (EventJournalException ex) {
            log.error("[AUDIT] event={} success={} username={} not recorded: {}",
                    name.value(), success, username, ex.getCode(), ex);
        }
    }

    @Transactional(readOnly = true)
    public List<AuthEvent> listEvents() {
        return store().findAllByOrderByCreatedDescIdDesc();
    }

    private AuthEventRepository store() {
        AuthEventRepository authEventRepository = authEventRepositoryProvider.getIfAvailable();
        if (authEventRepository == null) {
            throw new EventJournalException(EventJournalException.WRITE_EVENT_DB_NIL, "event store is not available", null);
        }
        return authEventRepository;
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > AuthEvent.MESSAGE_MAX_LENGTH
                ? message.substring(0, AuthEvent.MESSAGE_MAX_LENGTH)
                : message;
    }
}
