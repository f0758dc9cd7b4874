package com.flamingo.ai.knowledge.service.folder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.api.dto.response.BreadcrumbItem;
import com.flamingo.ai.knowledge.api.dto.response.FolderTreeNode;
import com.flamingo.ai.knowledge.domain.entity.Document;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import com.flamingo.ai.knowledge.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledge.domain.repository.DocumentFolderRepository;
import com.flamingo.ai.knowledge.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledge.exception.FolderCycleException;
import com.flamingo.ai.knowledge.exception.FolderNameConflictException;
import com.flamingo.ai.knowledge.exception.FolderNotFoundException;
import com.flamingo.ai.knowledge.exception.FolderValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FolderServiceImplTest {

  private static final String USER = "user-1";

  @Mock private DocumentFolderRepository folderRepository;

  @Mock private DocumentRepository documentRepository;

  private FolderServiceImpl folderService;

  private DocumentFolder projects;
  private DocumentFolder reports;
  private DocumentFolder archive2024;

  @BeforeEach
  void setUp() {
    folderService = new FolderServiceImpl(folderRepository, documentRepository);

    // projects > reports > 2024
    projects = folder("Projects", null);
    reports = folder("Reports", projects.getId());
    archive2024 = folder("2024", reports.getId());
    for (DocumentFolder f : List.of(projects, reports, archive2024)) {
      when(folderRepository.findByIdAndUserId(f.getId(), USER)).thenReturn(Optional.of(f));
    }
    when(folderRepository.save(any(DocumentFolder.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  @Test
  void shouldCreateFolderWithTrimmedNameAndNormalizedColor() {
    DocumentFolder created =
        folderService.createFolder(USER, "  Invoices  ", projects.getId(), "#A1B2C3");

    assertThat(created.getName()).isEqualTo("Invoices");
    assertThat(created.getColor()).isEqualTo("#a1b2c3");
    assertThat(created.getParentId()).isEqualTo(projects.getId());
    assertThat(created.getUserId()).isEqualTo(USER);
  }

  @Test
  void shouldRejectInvalidNameAndColor() {
    assertThatThrownBy(() -> folderService.createFolder(USER, "   ", null, null))
        .isInstanceOf(FolderValidationException.class);
    assertThatThrownBy(() -> folderService.createFolder(USER, "x".repeat(256), null, null))
        .isInstanceOf(FolderValidationException.class);
    assertThatThrownBy(() -> folderService.createFolder(USER, "Ok", null, "red"))
        .isInstanceOf(FolderValidationException.class);
  }

  @Test
  void shouldRejectDuplicateSiblingName() {
    when(folderRepository.findByUserIdAndParentIdIsNullOrderByNameAsc(USER))
        .thenReturn(List.of(projects));

    assertThatThrownBy(() -> folderService.createFolder(USER, "Projects", null, null))
        .isInstanceOf(FolderNameConflictException.class);
  }

  @Test
  void shouldRejectUnknownParent() {
    UUID unknown = UUID.randomUUID();
    when(folderRepository.findByIdAndUserId(unknown, USER)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> folderService.createFolder(USER, "Child", unknown, null))
        .isInstanceOf(FolderNotFoundException.class);
  }

  @Test
  void shouldAllowRenameToOwnName() {
    when(folderRepository.findByUserIdAndParentIdOrderByNameAsc(USER, projects.getId()))
        .thenReturn(List.of(reports));

    DocumentFolder renamed = folderService.renameFolder(USER, reports.getId(), "Reports");

    assertThat(renamed.getName()).isEqualTo("Reports");
  }

  @Test
  void shouldRejectMoveIntoItself() {
    assertThatThrownBy(() -> folderService.moveFolder(USER, reports.getId(), reports.getId()))
        .isInstanceOf(FolderCycleException.class)
        .hasMessage("Cannot move a folder into itself");
  }

  @Test
  void shouldRejectMoveIntoDescendant() {
    assertThatThrownBy(
            () -> folderService.moveFolder(USER, projects.getId(), archive2024.getId()))
        .isInstanceOf(FolderCycleException.class)
        .hasMessage("Cannot move a folder into one of its descendants");
    verify(folderRepository, never()).save(any());
  }

  @Test
  void shouldMoveFolderToRoot() {
    DocumentFolder moved = folderService.moveFolder(USER, archive2024.getId(), null);

    assertThat(moved.getParentId()).isNull();
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldDeleteSubtreeAndMoveDocumentsToRoot() {
    when(folderRepository.findByParentIdIn(List.of(projects.getId())))
        .thenReturn(List.of(reports));
    when(folderRepository.findByParentIdIn(List.of(reports.getId())))
        .thenReturn(List.of(archive2024));
    when(folderRepository.findByParentIdIn(List.of(archive2024.getId()))).thenReturn(List.of());
    when(documentRepository.clearFolder(anyCollection())).thenReturn(4);

    folderService.deleteFolder(USER, projects.getId());

    ArgumentCaptor<Collection<UUID>> cleared = ArgumentCaptor.forClass(Collection.class);
    verify(documentRepository).clearFolder(cleared.capture());
    assertThat(cleared.getValue())
        .containsExactly(projects.getId(), reports.getId(), archive2024.getId());
    verify(folderRepository)
        .deleteAllById(List.of(projects.getId(), reports.getId(), archive2024.getId()));
  }

  @Test
  void shouldBuildTreeWithPathsDepthsAndCounts() {
    DocumentFolder misc = folder("Misc", null);
    when(folderRepository.findByUserIdOrderByNameAsc(USER))
        .thenReturn(List.of(archive2024, misc, projects, reports));
    List<Object[]> counts = new ArrayList<>();
    counts.add(new Object[] {reports.getId(), 3L});
    when(documentRepository.countByFolder(USER, DocumentStatus.ARCHIVED)).thenReturn(counts);

    List<FolderTreeNode> tree = folderService.getFolderTree(USER);

    assertThat(tree).extracting(FolderTreeNode::getName).containsExactly("Misc", "Projects");
    FolderTreeNode reportsNode = tree.get(1).getChildren().get(0);
    assertThat(reportsNode.getDocumentCount()).isEqualTo(3L);
    assertThat(reportsNode.getDepth()).isEqualTo(1);
    FolderTreeNode leaf = reportsNode.getChildren().get(0);
    assertThat(leaf.getPath()).containsExactly("Projects", "Reports", "2024");
    assertThat(leaf.getDepth()).isEqualTo(2);
    assertThat(leaf.getDocumentCount()).isZero();
  }

  @Test
  void shouldReturnBreadcrumbFromRoot() {
    List<BreadcrumbItem> breadcrumb = folderService.getBreadcrumb(USER, archive2024.getId());

    assertThat(breadcrumb)
        .extracting(BreadcrumbItem::name)
        .containsExactly("Projects", "Reports", "2024");
  }

  @Test
  void shouldMoveDocumentIntoFolder() {
    Document document = Document.builder().id(UUID.randomUUID()).userId(USER).build();
    when(documentRepository.findByIdAndUserId(document.getId(), USER))
        .thenReturn(Optional.of(document));

    folderService.moveDocument(USER, document.getId(), reports.getId());

    assertThat(document.getFolderId()).isEqualTo(reports.getId());
    verify(documentRepository).save(document);
  }

  private static DocumentFolder folder(String name, UUID parentId) {
    return DocumentFolder.builder()
        .id(UUID.randomUUID())
        .userId(USER)
        .name(name)
        .parentId(parentId)
        .build();
  }
}
