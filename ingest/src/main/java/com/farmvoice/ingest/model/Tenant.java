package com.farmvoice.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A client organisation. Owns the Dynamics 365 credentials used to sync its
 * recordings and the active flag that gates new uploads.
 *
 * Managed outside this service; read-only here.
 *
 * DB table: tenants  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tenants")
public class Tenant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(name = "dynamics_url", nullable = false)
    private String dynamicsUrl;

    // Azure AD app registration used for the client-credentials grant.
    @Column(name = "dynamics_client_id", nullable = false)
    private String dynamicsClientId;

    @Column(name = "dynamics_client_secret", nullable = false, columnDefinition = "TEXT")
    private String dynamicsClientSecret;

    @Column(name = "dynamics_tenant_id", nullable = false)
    private String dynamicsTenantId;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Tenant() {}   // required by JPA

    public Tenant(String name, String dynamicsUrl, String dynamicsClientId,
                  String dynamicsClientSecret, String dynamicsTenantId) {
        this.name                 = name;
        this.dynamicsUrl          = dynamicsUrl;
        this.dynamicsClientId     = dynamicsClientId;
        this.dynamicsClientSecret = dynamicsClientSecret;
        this.dynamicsTenantId     = dynamicsTenantId;
    }

    public UUID    getId()                   { return id; }
    public String  getName()                 { return name; }
    public String  getDynamicsUrl()          { return dynamicsUrl; }
    public String  getDynamicsClientId()     { return dynamicsClientId; }
    public String  getDynamicsClientSecret() { return dynamicsClientSecret; }
    public String  getDynamicsTenantId()     { return dynamicsTenantId; }
    public boolean isActive()                { return active; }
    public Instant getCreatedAt()            { return createdAt; }
    public Instant getUpdatedAt()            { return updatedAt; }

    public void setActive(boolean active)    { this.active = active; }
}
