package com.flamingo.ai.knowledge.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for deleting or moving several documents at once. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkDocumentRequest {

  /** Operation applied to every listed document. */
  public enum Action {
    DELETE,
    MOVE
  }

  @NotNull(message = "Action is required")
  private Action action;

  @NotEmpty(message = "At least one document id is required")
  @Size(max = 100, message = "At most 100 documents per request")
  private List<UUID> documentIds;

  /** Target folder for MOVE; null moves to the root. */
  private UUID folderId;
}
