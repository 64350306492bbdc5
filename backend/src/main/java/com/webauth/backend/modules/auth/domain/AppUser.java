package com.webauth.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.webauth.backend.global.jpa.AbstractAssignedIdEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Registered account. Usernames are limited to 10 characters by the schema.
 */
@Entity
@Table(name = "users")
@EntityListeners(AuditingEntityListener.class)
public class AppUser extends AbstractAssignedIdEntity<String> {

    public static final int USERNAME_MAX_LENGTH = 10;

    @Id
    @Column(name = "username", nullable = false, updatable = false, length = USERNAME_MAX_LENGTH)
    private String username;

    @Column(name = "hashed_password", nullable = false, length = 255)
    private String hashedPassword;

    @Column(name = "full_name", nullable = false, length = 100)
    private String fullName;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "admin", nullable = false)
    private boolean admin;

    @Column(name = "confirmed", nullable = false)
    private boolean confirmed;

    @CreatedDate
    @Column(name = "created", nullable = false, updatable = false)
    private OffsetDateTime created;

    protected AppUser() {
    }

    public AppUser(String username, String fullName, String email, String hashedPassword) {
        this.username = username;
        this.fullName = fullName;
        this.email = email;
        this.hashedPassword = hashedPassword;
    }

    @Override
    public String getId() {
        return username;
    }

    public String getUsername() {
        return username;
    }

    public String getHashedPassword() {
        return hashedPassword;
    }

    public void setHashedPassword(String hashedPassword) {
        this.hashedPassword = hashedPassword;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public boolean isAdmin() {
        return admin;
    }

    public void setAdmin(boolean admin) {
        this.admin = admin;
    }

    public boolean isConfirmed() {
        return confirmed;
    }

    public void setConfirmed(boolean confirmed) {
        this.confirmed = confirmed;
    }

    public OffsetDateTime getCreated() {
        return created;
    }
}
