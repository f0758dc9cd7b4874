package com.flamingo.ai.knowledge.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for assembling document context for a conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationContextRequest {

  @NotBlank(message = "Thread id is required")
  private String threadId;

  @NotBlank(message = "Query is required")
  private String query;

  @Min(value = 1, message = "Token budget must be positive")
  private Integer maxTokens;
}
