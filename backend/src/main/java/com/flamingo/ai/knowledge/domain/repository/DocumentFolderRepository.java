package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for DocumentFolder entities. */
@Repository
public interface DocumentFolderRepository extends JpaRepository<DocumentFolder, UUID> {

  Optional<DocumentFolder> findByIdAndUserId(UUID id, String userId);

  List<DocumentFolder> findByUserIdOrderByNameAsc(String userId);

  List<DocumentFolder> findByUserIdAndParentIdOrderByNameAsc(String userId, UUID parentId);

  List<DocumentFolder> findByUserIdAndParentIdIsNullOrderByNameAsc(String userId);

  List<DocumentFolder> findByParentIdIn(Collection<UUID> parentIds);
}
