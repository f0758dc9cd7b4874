package com.flamingo.ai.knowledge.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a job delivered by the external job queue. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentJobRequest {

  @NotNull(message = "documentId is required")
  private UUID documentId;
}
