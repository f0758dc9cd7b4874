package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.CreateFolderRequest;
import com.flamingo.ai.knowledge.api.dto.request.MoveFolderRequest;
import com.flamingo.ai.knowledge.api.dto.request.RenameFolderRequest;
import com.flamingo.ai.knowledge.api.dto.response.BreadcrumbItem;
import com.flamingo.ai.knowledge.api.dto.response.FolderContentsResponse;
import com.flamingo.ai.knowledge.api.dto.response.FolderResponse;
import com.flamingo.ai.knowledge.api.dto.response.FolderTreeNode;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import com.flamingo.ai.knowledge.service.folder.FolderService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the document folder hierarchy. */
@RestController
@RequestMapping("/api/folders")
@RequiredArgsConstructor
public class FolderController {

  private final FolderService folderService;

  /** Creates a folder. */
  @PostMapping
  public ResponseEntity<FolderResponse> createFolder(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @Valid @RequestBody CreateFolderRequest request) {
    DocumentFolder folder =
        folderService.createFolder(
            userId, request.getName(), request.getParentId(), request.getColor());
    // A new folder holds no documents
    return ResponseEntity.status(HttpStatus.CREATED).body(FolderResponse.fromEntity(folder, 0));
  }

  /** Gets the folder tree. */
  @GetMapping("/tree")
  public ResponseEntity<List<FolderTreeNode>> getFolderTree(
      @RequestHeader(ApiHeaders.USER_ID) String userId) {
    return ResponseEntity.ok(folderService.getFolderTree(userId));
  }

  /** Gets one level of the folder browser; without {@code folderId} the root level. */
  @GetMapping("/contents")
  public ResponseEntity<FolderContentsResponse> getFolderContents(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @RequestParam(value = "folderId", required = false) UUID folderId,
      @RequestParam(value = "limit", defaultValue = "50") int limit,
      @RequestParam(value = "offset", defaultValue = "0") int offset) {
    return ResponseEntity.ok(
        FolderContentsResponse.from(
            folderService.getFolderContents(
                userId, folderId, Math.min(Math.max(limit, 1), 100), Math.max(offset, 0))));
  }

  /** Gets the ancestor chain of a folder, root first. */
  @GetMapping("/{folderId}/breadcrumb")
  public ResponseEntity<List<BreadcrumbItem>> getBreadcrumb(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID folderId) {
    return ResponseEntity.ok(folderService.getBreadcrumb(userId, folderId));
  }

  /** Renames a folder. */
  @PatchMapping("/{folderId}")
  public ResponseEntity<FolderResponse> renameFolder(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @PathVariable UUID folderId,
      @Valid @RequestBody RenameFolderRequest request) {
    DocumentFolder folder = folderService.renameFolder(userId, folderId, request.getName());
    return ResponseEntity.ok(FolderResponse.fromEntity(folder, 0));
  }

  /** Moves a folder under another folder, or to the root. */
  @PutMapping("/{folderId}/parent")
  public ResponseEntity<FolderResponse> moveFolder(
      @RequestHeader(ApiHeaders.USER_ID) String userId,
      @PathVariable UUID folderId,
      @RequestBody MoveFolderRequest request) {
    DocumentFolder folder = folderService.moveFolder(userId, folderId, request.getParentId());
    return ResponseEntity.ok(FolderResponse.fromEntity(folder, 0));
  }

  /** Deletes a folder and its subfolders; contained documents move to the root. */
  @DeleteMapping("/{folderId}")
  public ResponseEntity<Void> deleteFolder(
      @RequestHeader(ApiHeaders.USER_ID) String userId, @PathVariable UUID folderId) {
    folderService.deleteFolder(userId, folderId);
    return ResponseEntity.noContent().build();
  }
}
