package com.modelrouter.policy.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One operator-managed routing policy, unique per (domain, action).
 *
 * Column mapping (R2DBC snake_case convention):
 *   candidateModelIds → candidate_model_ids
 *   createdAt         → created_at
 *   updatedAt         → updated_at
 *
 * candidateModelIds: JSON-serialised ordered List<String>
 */
@Data
@NoArgsConstructor
@Table("routing_policy")
public class PolicyEntity {

    @Id
    private Long id;

    private String domain;

    private String action;

    /** JSON-serialised ordered {@code List<String>} of preferred model ids */
    private String candidateModelIds;

    private int priority;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
