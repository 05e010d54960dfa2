package com.farmvoice.ingest.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-tenant description of one CRM entity: which extracted fields map to
 * which CRM columns, how they are validated, and which words in a
 * transcript suggest this entity.
 *
 * JSON shapes:
 *   field_mappings:     {"ear_tag": "bt_ear_tag", ...}
 *   validation_rules:   {"rfid": {"type": "string", "required": false, "pattern": "^\\d{15,20}$"}}
 *   detection_keywords: ["heifer", "calving", ...]
 *
 * DB table: schema_mappings  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "schema_mappings")
public class SchemaMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    // Entity label the extractor reports, e.g. "animal".
    @Column(name = "entity_name", nullable = false)
    private String entityName;

    // Entity set name on the CRM side, e.g. "bt_animals".
    @Column(name = "remote_entity_name", nullable = false)
    private String remoteEntityName;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "field_mappings", nullable = false)
    private Map<String, String> fieldMappings = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validation_rules")
    private Map<String, Map<String, Object>> validationRules = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detection_keywords")
    private List<String> detectionKeywords = new ArrayList<>();

    @Column(nullable = false)
    private boolean active = true;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected SchemaMapping() {}   // required by JPA

    public SchemaMapping(UUID tenantId, String entityName, String remoteEntityName) {
        this.tenantId         = tenantId;
        this.entityName       = entityName;
        this.remoteEntityName = remoteEntityName;
    }

    public UUID    getId()               { return id; }
    public UUID    getTenantId()         { return tenantId; }
    public String  getEntityName()       { return entityName; }
    public String  getRemoteEntityName() { return remoteEntityName; }
    public boolean isActive()            { return active; }
    public String  getDescription()      { return description; }
    public Instant getCreatedAt()        { return createdAt; }

    public Map<String, String>              getFieldMappings()     { return fieldMappings; }
    public Map<String, Map<String, Object>> getValidationRules()   { return validationRules; }
    public List<String>                     getDetectionKeywords() { return detectionKeywords; }

    public void setFieldMappings(Map<String, String> v)                 { this.fieldMappings = v; }
    public void setValidationRules(Map<String, Map<String, Object>> v)  { this.validationRules = v; }
    public void setDetectionKeywords(List<String> v)                    { this.detectionKeywords = v; }
    public void setActive(boolean active)                               { this.active = active; }
    public void setDescription(String description)                      { this.description = description; }
}
