package com.flamingo.ai.knowledge.api.dto.request;

import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for semantic document search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentSearchRequest {

  @NotBlank(message = "Query is required")
  private String query;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 100, message = "Limit must be at most 100")
  private Integer limit;

  @DecimalMin(value = "-1.0", message = "Minimum similarity must be at least -1")
  @DecimalMax(value = "1.0", message = "Minimum similarity must be at most 1")
  private Double minSimilarity;

  private DocumentScope scope;
  private String threadId;
  private List<FileType> fileTypes;
  private UUID folderId;
}
