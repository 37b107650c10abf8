package com.motaz.rfm.training.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "t_customers", schema = "public")
public class CustomerEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "customers_entity_seq_generator")
    @SequenceGenerator(name = "customers_entity_seq_generator", sequenceName = "customers_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "customer_id", nullable = false, unique = true, length = 64)
    private String customerId;

    @Column(name = "email")
    private String email;

    @Column(name = "country", length = 64)
    private String country;

    @Column(name = "created_at")
    private Instant createdAt;

}
