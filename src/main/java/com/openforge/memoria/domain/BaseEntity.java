package com.openforge.memoria.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * Identity and optimistic-lock columns shared by every table.
 *
 * Timestamps are NOT audited here: every table carries its own epoch-millis
 * columns (created_at_epoch, completed_at_epoch …) stamped from the injected
 * Clock, because the stored rows must stay compatible with existing data and
 * staleness rules compare raw epoch values.
 *
 * - id      : surrogate key, IDENTITY
 * - version : JPA @Version, only bumped by entity saves; bulk status updates
 *             issued through @Modifying queries leave it untouched
 */
@Getter
@Setter
@MappedSuperclass
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    @Column(nullable = false)
    private Integer version = 0;
}
