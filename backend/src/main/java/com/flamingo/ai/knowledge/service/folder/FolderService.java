package com.flamingo.ai.knowledge.service.folder;

import com.flamingo.ai.knowledge.api.dto.response.BreadcrumbItem;
import com.flamingo.ai.knowledge.api.dto.response.FolderContents;
import com.flamingo.ai.knowledge.api.dto.response.FolderTreeNode;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import java.util.List;
import java.util.UUID;

/** Service interface for the per-user document folder hierarchy. */
public interface FolderService {

  /**
   * Creates a folder.
   *
   * @param userId the owner
   * @param name the folder name, 1 to 255 characters, unique among its siblings
   * @param parentId the parent folder, or null for a root folder
   * @param color optional display color as {@code #rrggbb}
   * @return the created folder
   * @throws com.flamingo.ai.knowledge.exception.FolderNotFoundException if the parent is missing
   * @throws com.flamingo.ai.knowledge.exception.FolderNameConflictException if a sibling has the
   *     same name
   */
  DocumentFolder createFolder(String userId, String name, UUID parentId, String color);

  /**
   * Renames a folder, keeping sibling names unique.
   *
   * @return the renamed folder
   */
  DocumentFolder renameFolder(String userId, UUID folderId, String name);

  /**
   * Deletes a folder and all of its subfolders. Documents inside any of them are moved to the
   * root, never deleted.
   */
  void deleteFolder(String userId, UUID folderId);

  /**
   * Moves a folder under a new parent.
   *
   * @param newParentId the new parent, or null to move the folder to the root
   * @return the moved folder
   * @throws com.flamingo.ai.knowledge.exception.FolderCycleException if the target is the folder
   *     itself or one of its descendants; nothing is changed in that case
   */
  DocumentFolder moveFolder(String userId, UUID folderId, UUID newParentId);

  /**
   * Returns the user's folders as a tree with depths, paths and non-archived document counts.
   *
   * @return the root folders, children sorted by name
   */
  List<FolderTreeNode> getFolderTree(String userId);

  /**
   * Returns the ancestor chain of a folder.
   *
   * @return the folders from the root down to and including {@code folderId}
   */
  List<BreadcrumbItem> getBreadcrumb(String userId, UUID folderId);

  /**
   * Returns one level of the folder browser.
   *
   * @param folderId the folder to open, or null for the root
   * @param limit page size for documents
   * @param offset document offset
   */
  FolderContents getFolderContents(String userId, UUID folderId, int limit, int offset);

  /**
   * Moves a document into a folder.
   *
   * @param folderId the target folder, or null to move the document to the root
   */
  void moveDocument(String userId, UUID documentId, UUID folderId);
}
