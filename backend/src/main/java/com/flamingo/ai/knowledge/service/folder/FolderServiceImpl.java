package com.flamingo.ai.knowledge.service.folder;

import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.atRoot;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.inFolder;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.notArchived;
import static com.flamingo.ai.knowledge.domain.repository.DocumentSpecifications.ownedBy;

import com.flamingo.ai.knowledge.api.dto.response.BreadcrumbItem;
import com.flamingo.ai.knowledge.api.dto.response.FolderContents;
import com.flamingo.ai.knowledge.api.dto.response.FolderTreeNode;
import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.repository.DocumentFolderRepository;
import com.flamingo.ai.knowledge.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledge.domain.repository.OffsetPageRequest;
import com.flamingo.ai.knowledge.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledge.exception.FolderCycleException;
import com.flamingo.ai.knowledge.exception.FolderNameConflictException;
import com.flamingo.ai.knowledge.exception.FolderNotFoundException;
import com.flamingo.ai.knowledge.exception.FolderValidationException;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of FolderService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FolderServiceImpl implements FolderService {

  private static final int MAX_NAME_LENGTH = 255;
  private static final Pattern COLOR_PATTERN = Pattern.compile("^#[0-9a-f]{6}$");

  private final DocumentFolderRepository folderRepository;
  private final DocumentRepository documentRepository;

  @Override
  @Transactional
  @Timed(value = "folder.create", description = "Time to create a folder")
  public DocumentFolder createFolder(String userId, String name, UUID parentId, String color) {
    String folderName = validateName(name);
    String folderColor = normalizeColor(color);
    if (parentId != null) {
      requireFolder(userId, parentId);
    }
    ensureUniqueName(userId, parentId, folderName, null);

    DocumentFolder folder =
        DocumentFolder.builder()
            .userId(userId)
            .name(folderName)
            .parentId(parentId)
            .color(folderColor)
            .build();
    DocumentFolder saved = folderRepository.save(folder);
    log.info("Created folder {} '{}' under {}", saved.getId(), folderName, parentId);
    return saved;
  }

  @Override
  @Transactional
  public DocumentFolder renameFolder(String userId, UUID folderId, String name) {
    DocumentFolder folder = requireFolder(userId, folderId);
    String folderName = validateName(name);
    ensureUniqueName(userId, folder.getParentId(), folderName, folderId);

    folder.setName(folderName);
    DocumentFolder saved = folderRepository.save(folder);
    log.info("Renamed folder {} to '{}'", folderId, folderName);
    return saved;
  }

  @Override
  @Transactional
  public void deleteFolder(String userId, UUID folderId) {
    requireFolder(userId, folderId);

    List<UUID> subtree = collectSubtree(folderId);
    int orphaned = documentRepository.clearFolder(subtree);
    folderRepository.deleteAllById(subtree);
    log.info(
        "Deleted folder {} with {} subfolder(s); {} document(s) moved to root",
        folderId,
        subtree.size() - 1,
        orphaned);
  }

  @Override
  @Transactional
  public DocumentFolder moveFolder(String userId, UUID folderId, UUID newParentId) {
    DocumentFolder folder = requireFolder(userId, folderId);

    if (folderId.equals(newParentId)) {
      throw new FolderCycleException(folderId, newParentId, "Cannot move a folder into itself");
    }
    if (newParentId != null) {
      requireFolder(userId, newParentId);
      boolean targetIsDescendant =
          ancestorChain(userId, newParentId).stream()
              .anyMatch(ancestor -> ancestor.getId().equals(folderId));
      if (targetIsDescendant) {
        throw new FolderCycleException(
            folderId, newParentId, "Cannot move a folder into one of its descendants");
      }
    }
    ensureUniqueName(userId, newParentId, folder.getName(), folderId);

    folder.setParentId(newParentId);
    DocumentFolder saved = folderRepository.save(folder);
    log.info("Moved folder {} under {}", folderId, newParentId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public List<FolderTreeNode> getFolderTree(String userId) {
    List<DocumentFolder> folders = folderRepository.findByUserIdOrderByNameAsc(userId);
    Map<UUID, Long> counts = documentCounts(userId);

    Map<UUID, FolderTreeNode> nodes = new LinkedHashMap<>();
    for (DocumentFolder folder : folders) {
      nodes.put(
          folder.getId(),
          FolderTreeNode.builder()
              .id(folder.getId())
              .name(folder.getName())
              .parentId(folder.getParentId())
              .color(folder.getColor())
              .documentCount(counts.getOrDefault(folder.getId(), 0L))
              .createdAt(folder.getCreatedAt())
              .updatedAt(folder.getUpdatedAt())
              .build());
    }

    List<FolderTreeNode> roots = new ArrayList<>();
    for (FolderTreeNode node : nodes.values()) {
      FolderTreeNode parent = node.getParentId() != null ? nodes.get(node.getParentId()) : null;
      if (parent != null) {
        parent.getChildren().add(node);
      } else {
        roots.add(node);
      }
    }
    for (FolderTreeNode root : roots) {
      assignPaths(root, List.of(), 0);
    }
    return roots;
  }

  private static void assignPaths(FolderTreeNode node, List<String> parentPath, int depth) {
    List<String> path = new ArrayList<>(parentPath);
    path.add(node.getName());
    node.setPath(path);
    node.setDepth(depth);
    for (FolderTreeNode child : node.getChildren()) {
      assignPaths(child, path, depth + 1);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<BreadcrumbItem> getBreadcrumb(String userId, UUID folderId) {
    return ancestorChain(userId, folderId).stream().map(BreadcrumbItem::fromEntity).toList();
  }

  @Override
  @Transactional(readOnly = true)
  public FolderContents getFolderContents(String userId, UUID folderId, int limit, int offset) {
    DocumentFolder folder = null;
    List<BreadcrumbItem> breadcrumb = List.of();
    List<DocumentFolder> subfolders;
    Specification<Document> location;

    if (folderId != null) {
      folder = requireFolder(userId, folderId);
      breadcrumb = getBreadcrumb(userId, folderId);
      subfolders = folderRepository.findByUserIdAndParentIdOrderByNameAsc(userId, folderId);
      location = inFolder(folderId);
    } else {
      subfolders = folderRepository.findByUserIdAndParentIdIsNullOrderByNameAsc(userId);
      location = atRoot();
    }

    Page<Document> page =
        documentRepository.findAll(
            ownedBy(userId).and(notArchived()).and(location),
            new OffsetPageRequest(offset, limit, Sort.by(Sort.Direction.DESC, "createdAt")));

    return FolderContents.builder()
        .folder(folder)
        .breadcrumb(breadcrumb)
        .subfolders(subfolders)
        .documents(page.getContent())
        .totalDocuments(page.getTotalElements())
        .documentCounts(documentCounts(userId))
        .build();
  }

  @Override
  @Transactional
  public void moveDocument(String userId, UUID documentId, UUID folderId) {
    Document document =
        documentRepository
            .findByIdAndUserId(documentId, userId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    if (folderId != null) {
      requireFolder(userId, folderId);
    }
    document.setFolderId(folderId);
    documentRepository.save(document);
    log.info("Moved document {} to folder {}", documentId, folderId);
  }

  /** Non-archived document counts of the user's folders. */
  private Map<UUID, Long> documentCounts(String userId) {
    Map<UUID, Long> counts = new HashMap<>();
    for (Object[] row : documentRepository.countByFolder(userId, DocumentStatus.ARCHIVED)) {
      counts.put((UUID) row[0], ((Number) row[1]).longValue());
    }
    return counts;
  }

  private DocumentFolder requireFolder(String userId, UUID folderId) {
    return folderRepository
        .findByIdAndUserId(folderId, userId)
        .orElseThrow(() -> new FolderNotFoundException(folderId));
  }

  /** Folders from the root down to {@code folderId}, inclusive. */
  private List<DocumentFolder> ancestorChain(String userId, UUID folderId) {
    List<DocumentFolder> chain = new ArrayList<>();
    Set<UUID> visited = new HashSet<>();
    UUID current = folderId;
    while (current != null && visited.add(current)) {
      DocumentFolder folder = requireFolder(userId, current);
      chain.add(folder);
      current = folder.getParentId();
    }
    Collections.reverse(chain);
    return chain;
  }

  /** The folder and all of its descendants, breadth first. */
  private List<UUID> collectSubtree(UUID folderId) {
    List<UUID> subtree = new ArrayList<>();
    Set<UUID> seen = new HashSet<>();
    List<UUID> level = List.of(folderId);
    while (!level.isEmpty()) {
      List<UUID> fresh = level.stream().filter(seen::add).toList();
      subtree.addAll(fresh);
      if (fresh.isEmpty()) {
        break;
      }
      level = folderRepository.findByParentIdIn(fresh).stream().map(DocumentFolder::getId).toList();
    }
    return subtree;
  }

  private void ensureUniqueName(String userId, UUID parentId, String name, UUID excludeId) {
    List<DocumentFolder> siblings =
        parentId != null
            ? folderRepository.findByUserIdAndParentIdOrderByNameAsc(userId, parentId)
            : folderRepository.findByUserIdAndParentIdIsNullOrderByNameAsc(userId);
    boolean taken =
        siblings.stream()
            .anyMatch(s -> s.getName().equals(name) && !Objects.equals(s.getId(), excludeId));
    if (taken) {
      throw new FolderNameConflictException(name);
    }
  }

  private static String validateName(String name) {
    String trimmed = name != null ? name.trim() : "";
    if (trimmed.isEmpty()) {
      throw new FolderValidationException("Folder name must not be empty");
    }
    if (trimmed.length() > MAX_NAME_LENGTH) {
      throw new FolderValidationException(
          "Folder name must be at most " + MAX_NAME_LENGTH + " characters");
    }
    return trimmed;
  }

  private static String normalizeColor(String color) {
    if (color == null || color.isBlank()) {
      return null;
    }
    String normalized = color.trim().toLowerCase(Locale.ROOT);
    if (!COLOR_PATTERN.matcher(normalized).matches()) {
      throw new FolderValidationException("Folder color must be a hex color like #1a2b3c");
    }
    return normalized;
  }
}
