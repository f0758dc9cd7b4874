package com.flamingo.ai.knowledge.api.dto.request;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for moving a document. A null folder moves the document to the root. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveDocumentRequest {

  private UUID folderId;
}
