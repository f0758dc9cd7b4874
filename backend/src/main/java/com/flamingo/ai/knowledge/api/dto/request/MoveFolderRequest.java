package com.flamingo.ai.knowledge.api.dto.request;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for moving a folder. A null parent moves the folder to the root. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveFolderRequest {

  private UUID parentId;
}
