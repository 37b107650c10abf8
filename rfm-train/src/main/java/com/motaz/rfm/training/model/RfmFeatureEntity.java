package com.motaz.rfm.training.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "t_rfm_features", schema = "public",
        uniqueConstraints = @UniqueConstraint(name = "uq_customer_calc_date", columnNames = {"customer_id", "calc_date"}),
        indexes = @Index(name = "idx_rfm_customer_calc_date", columnList = "customer_id, calc_date"))
public class RfmFeatureEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "rfm_features_entity_seq_generator")
    @SequenceGenerator(name = "rfm_features_entity_seq_generator", sequenceName = "rfm_features_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "customer_id", nullable = false, length = 64)
    private String customerId;

    @Column(name = "calc_date", nullable = false)
    private LocalDateTime calcDate;

    @Column(name = "window_days", nullable = false)
    private Integer windowDays;

    @Column(name = "recency_days", nullable = false)
    private Integer recencyDays;

    @Column(name = "frequency", nullable = false)
    private Integer frequency;

    @Column(name = "monetary", nullable = false, precision = 18, scale = 2)
    private BigDecimal monetary;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    public void setCreatedAt() {
        this.createdAt = Instant.now();
    }

}
