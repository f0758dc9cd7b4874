package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository
    extends JpaRepository<Document, UUID>, JpaSpecificationExecutor<Document> {

  Optional<Document> findByIdAndUserId(UUID id, String userId);

  List<Document> findByIdInAndUserId(Collection<UUID> ids, String userId);

  /** Whether the user already has a live document with the same content. */
  boolean existsByUserIdAndContentHashAndStatusNot(
      String userId, String contentHash, DocumentStatus status);

  /** Every version of a document: the first version and the ones pointing at it, newest first. */
  @Query(
      "SELECT d FROM Document d WHERE d.userId = :userId "
          + "AND (d.id = :rootId OR d.parentDocumentId = :rootId) ORDER BY d.version DESC")
  List<Document> findVersionChain(@Param("userId") String userId, @Param("rootId") UUID rootId);

  /** Ready documents visible to a conversation: global ones plus those attached to the thread. */
  @Query(
      "SELECT d FROM Document d WHERE d.userId = :userId AND d.status = :status "
          + "AND (d.scope = :globalScope OR d.threadId = :threadId)")
  List<Document> findConversationCandidates(
      @Param("userId") String userId,
      @Param("threadId") String threadId,
      @Param("status") DocumentStatus status,
      @Param("globalScope") DocumentScope globalScope);

  /** Moves every document of the given folders to the root. */
  @Modifying
  @Query("UPDATE Document d SET d.folderId = null WHERE d.folderId IN :folderIds")
  int clearFolder(@Param("folderIds") Collection<UUID> folderIds);

  /** Per-folder counts of the user's documents, excluding the given status. */
  @Query(
      "SELECT d.folderId, COUNT(d) FROM Document d "
          + "WHERE d.userId = :userId AND d.folderId IS NOT NULL AND d.status <> :excluded "
          + "GROUP BY d.folderId")
  List<Object[]> countByFolder(
      @Param("userId") String userId, @Param("excluded") DocumentStatus excluded);
}
