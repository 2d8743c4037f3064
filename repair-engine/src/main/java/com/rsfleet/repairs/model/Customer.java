package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A fleet operator whose units are repaired.
 *
 * Names are stored lower-cased so that lookups are case-insensitive.
 */
@Entity
@Table(name = "customers")
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Customer() {}   // required by JPA

    public Customer(String name) {
        this.name = name.toLowerCase(Locale.ROOT);
    }

    public UUID    getId()        { return id; }
    public String  getName()      { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
