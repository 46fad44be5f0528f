package com.ayni.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of one identity in one role.
 */
@Entity
@Table(name = "role_assignments", uniqueConstraints = {
    @UniqueConstraint(name = "uk_role_identity", columnNames = {"identity_address", "role_name"})
})
public class RoleAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "identity_address", nullable = false, length = 42)
    private String identity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "role_name", nullable = false, length = 16)
    private Role role;

    @NotNull
    @Column(name = "granted_by", nullable = false, length = 42)
    private String grantedBy;

    @NotNull
    @Column(name = "granted_at", nullable = false)
    private Instant grantedAt;

    protected RoleAssignment() {}

    public static RoleAssignment grant(String identity, Role role, String grantedBy, Instant now) {
        var assignment = new RoleAssignment();
        assignment.identity = identity;
        assignment.role = role;
        assignment.grantedBy = grantedBy;
        assignment.grantedAt = now;
        return assignment;
    }

    public UUID getId() { return id; }
    public String getIdentity() { return identity; }
    public Role getRole() { return role; }
    public String getGrantedBy() { return grantedBy; }
    public Instant getGrantedAt() { return grantedAt; }
}
