package com.flamingo.ai.knowledge.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One page of a document listing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentListResponse {

  private List<DocumentResponse> documents;
  private long total;
  private int limit;
  private long offset;
}
