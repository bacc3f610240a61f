package org.epistula.backup.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A row of the tenant catalog. Temporary validation workspaces are registered here as inactive rows whose
 * schema name carries the {@code _temp} suffix.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity(name = "Tenant")
@Table(name = "universities", schema = "public")
public class Tenant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "code", nullable = false, unique = true)
    private String code;

    @Column(name = "schema_name", nullable = false, unique = true)
    private String schemaName;

    @Column(name = "description")
    private String description;

    @Column(name = "is_active")
    private boolean active;

    @Column(name = "logo_url")
    private String logoUrl;

    @Column(name = "created_by")
    private Integer createdBy;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;
}
