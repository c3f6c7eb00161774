package com.openforge.memoria.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A structured record describing one unit of work done during a session.
 * Written once per successful extraction call, never updated.
 *
 * facts / concepts / files_read / files_modified are JSON arrays of strings.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "observations",
    indexes = @Index(name = "idx_observations_memory_session", columnList = "memory_session_id")
)
public class Observation extends BaseEntity {

    @Column(name = "memory_session_id", nullable = false, length = 128)
    private String memorySessionId;

    @Column(name = "project", nullable = false, length = 256)
    private String project;

    /** bugfix, feature, refactor, change, discovery, decision … */
    @Column(name = "type", nullable = false, length = 32)
    private String type;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "subtitle", columnDefinition = "TEXT")
    private String subtitle;

    @Column(name = "narrative", columnDefinition = "TEXT")
    private String narrative;

    @Column(name = "facts", columnDefinition = "TEXT")
    private String facts;

    @Column(name = "concepts", columnDefinition = "TEXT")
    private String concepts;

    @Column(name = "files_read", columnDefinition = "TEXT")
    private String filesRead;

    @Column(name = "files_modified", columnDefinition = "TEXT")
    private String filesModified;

    @Column(name = "prompt_number")
    private Integer promptNumber;

    @Builder.Default
    @Column(name = "discovery_tokens", nullable = false)
    private Integer discoveryTokens = 0;

    @Column(name = "created_at_epoch", nullable = false)
    private Long createdAtEpoch;
}
