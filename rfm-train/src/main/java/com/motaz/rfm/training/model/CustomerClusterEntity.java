package com.motaz.rfm.training.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "t_customer_clusters", schema = "public",
        uniqueConstraints = @UniqueConstraint(name = "uq_customer_cluster_calc_date", columnNames = {"customer_id", "calc_date"}),
        indexes = @Index(name = "idx_cluster_customer_calc_date", columnList = "customer_id, calc_date"))
public class CustomerClusterEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "customer_clusters_entity_seq_generator")
    @SequenceGenerator(name = "customer_clusters_entity_seq_generator", sequenceName = "customer_clusters_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "customer_id", nullable = false, length = 64)
    private String customerId;

    @Column(name = "calc_date", nullable = false)
    private LocalDateTime calcDate;

    // raw k-means label
    @Column(name = "cluster_id", nullable = false)
    private Integer clusterId;

    @Column(name = "segment_name", nullable = false, length = 32)
    private String segmentName;

    @Column(name = "cluster_score")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> clusterScore;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    public void setCreatedAt() {
        this.createdAt = Instant.now();
    }

}
