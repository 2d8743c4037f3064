package com.rsfleet.repairs.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * Login identity of a person, held by value inside a profile.
 * Credentials live with the surrounding authentication layer, not here.
 */
@Embeddable
public class Identity {

    @Column(nullable = false, unique = true, length = 150)
    private String username;

    @Column(name = "full_name", length = 150)
    private String fullName;

    @Column(length = 254)
    private String email;

    protected Identity() {}   // required by JPA

    public Identity(String username, String fullName, String email) {
        this.username = username;
        this.fullName = fullName;
        this.email    = email;
    }

    public String getUsername() { return username; }
    public String getFullName() { return fullName; }
    public String getEmail()    { return email; }
}
