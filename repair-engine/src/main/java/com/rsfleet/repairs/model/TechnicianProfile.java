package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * A field technician. Manager capabilities are not a subtype: they live in a
 * separate ManagerAuthorization row that only managers have.
 *
 * DB table: technicians  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "technicians")
public class TechnicianProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Embedded
    private Identity identity;

    @Column(name = "phone_number", length = 15)
    private String phoneNumber;

    @Column(length = 100)
    private String expertise;

    protected TechnicianProfile() {}   // required by JPA

    public TechnicianProfile(Identity identity) {
        this.identity = identity;
    }

    public UUID     getId()          { return id; }
    public Identity getIdentity()    { return identity; }
    public String   getPhoneNumber() { return phoneNumber; }
    public String   getExpertise()   { return expertise; }

    public void setPhoneNumber(String v) { this.phoneNumber = v; }
    public void setExpertise(String v)   { this.expertise = v; }
}
