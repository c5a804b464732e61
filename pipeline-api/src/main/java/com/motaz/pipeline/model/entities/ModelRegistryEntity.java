package com.motaz.pipeline.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "t_model_registry", schema = "public")
public class ModelRegistryEntity {

    @Id
    @Column(name = "model_id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "model_registry_entity_seq_generator")
    @SequenceGenerator(name = "model_registry_entity_seq_generator", sequenceName = "model_registry_id_seq", allocationSize = 100)
    private Long id;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "kernel", nullable = false, length = 16)
    private String kernel;

    @Column(name = "nu", nullable = false)
    private Double nu;

    @Column(name = "gamma", nullable = false, length = 32)
    private String gamma;

    @Column(name = "window_size", nullable = false)
    private Integer windowSize;

    @Column(name = "n_clusters", nullable = false)
    private Integer clusters;

    @Column(name = "linkage", nullable = false, length = 16)
    private String linkage;

    @Column(name = "feature_schema", nullable = false, length = 4000)
    private String featureSchema;

    @Column(name = "schema_hash", nullable = false, length = 64)
    private String schemaHash;

    @Column(name = "trained_rows", nullable = false)
    private Long trainedRows;

    @Column(name = "notes", length = 4000)
    private String notes;

    @Column(name = "model_bytes", nullable = false, length = 64 * 1024 * 1024)
    private byte[] modelBytes;


    @PrePersist
    public void setCreatedAt() {
        this.createdAt = Instant.now();
    }

}
