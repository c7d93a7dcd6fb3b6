package com.esplanada.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A rated restaurant. Only the fields the rating engine needs are kept here.
 */
@Entity
@Table(name = "subjects")
public class Subject {

    @Id
    @Column(length = 100)
    private String id;

    @NotNull
    @Column(nullable = false, length = 200)
    private String name;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected Subject() {}

    public static Subject create(String id, String name, Instant createdAt) {
        if (id == null || id.isBlank() || id.length() > 100) {
            throw new IllegalArgumentException("Subject ID must be 1-100 characters");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subject name cannot be blank");
        }
        Subject subject = new Subject();
        subject.id = id;
        subject.name = name.trim();
        subject.createdAt = createdAt;
        return subject;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
