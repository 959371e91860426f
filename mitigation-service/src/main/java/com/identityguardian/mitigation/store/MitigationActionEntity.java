package com.identityguardian.mitigation.store;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of {@code mitigation_action}. Timestamps are stored as UTC {@link LocalDateTime};
 * enums as their names.
 */
@Data
@NoArgsConstructor
@Table("mitigation_action")
public class MitigationActionEntity {

    @Id
    private Long id;

    private String correlationToken;
    private String principalId;
    private String kind;
    private String state;
    private String reason;
    private int compositeScore;
    private boolean directorySucceeded;
    private String directoryMessage;
    private String notificationStatus;

    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
    private String resolutionOutcome;
}
