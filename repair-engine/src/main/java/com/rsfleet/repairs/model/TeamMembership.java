package com.rsfleet.repairs.model;

import jakarta.persistence.*;

import java.util.UUID;

/**
 * Directed edge "manager manages member". A manager's team is the set of
 * rows with their id in manager_id.
 *
 * DB table: team_memberships  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "team_memberships",
       uniqueConstraints = @UniqueConstraint(
               name = "uq_team_memberships_manager_member",
               columnNames = {"manager_id", "member_id"}))
public class TeamMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "manager_id", nullable = false, updatable = false)
    private UUID managerId;

    @Column(name = "member_id", nullable = false, updatable = false)
    private UUID memberId;

    protected TeamMembership() {}   // required by JPA

    public TeamMembership(UUID managerId, UUID memberId) {
        this.managerId = managerId;
        this.memberId  = memberId;
    }

    public UUID getId()        { return id; }
    public UUID getManagerId() { return managerId; }
    public UUID getMemberId()  { return memberId; }
}
