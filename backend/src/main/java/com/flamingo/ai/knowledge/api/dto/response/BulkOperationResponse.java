package com.flamingo.ai.knowledge.api.dto.response;

import com.flamingo.ai.knowledge.api.dto.request.BulkDocumentRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a bulk document operation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationResponse {

  private BulkDocumentRequest.Action action;
  private int requested;
  private int affected;
}
