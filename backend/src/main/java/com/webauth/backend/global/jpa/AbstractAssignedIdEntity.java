package com.webauth.backend.global.jpa;

import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;

import org.springframework.data.domain.Persistable;

/**
 * Entities whose primary key is chosen by the application (usernames, token hashes).
 * Reporting {@code isNew} explicitly makes {@code save} issue an INSERT, so a duplicate key
 * surfaces as a constraint violation instead of silently merging into the existing row.
 */
@MappedSuperclass
public abstract class AbstractAssignedIdEntity<ID> implements Persistable<ID> {

    @Transient
    private boolean persisted;

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }
}
