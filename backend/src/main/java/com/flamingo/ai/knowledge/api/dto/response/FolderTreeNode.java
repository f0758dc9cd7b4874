package com.flamingo.ai.knowledge.api.dto.response;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A folder within the user's folder tree.
 *
 * <p>{@code path} holds the folder names from the root down to and including this folder, and
 * {@code depth} is zero for root folders.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FolderTreeNode {

  private UUID id;
  private String name;
  private UUID parentId;
  private String color;
  private long documentCount;
  private int depth;
  @Builder.Default private List<String> path = new ArrayList<>();
  @Builder.Default private List<FolderTreeNode> children = new ArrayList<>();
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
}
