package com.flamingo.ai.knowledge.api.rest;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.knowledge.api.dto.response.BreadcrumbItem;
import com.flamingo.ai.knowledge.api.dto.response.FolderContents;
import com.flamingo.ai.knowledge.api.dto.response.FolderTreeNode;
import com.flamingo.ai.knowledge.domain.entity.DocumentFolder;
import com.flamingo.ai.knowledge.exception.FolderCycleException;
import com.flamingo.ai.knowledge.exception.FolderNotFoundException;
import com.flamingo.ai.knowledge.exception.GlobalExceptionHandler;
import com.flamingo.ai.knowledge.service.folder.FolderService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class FolderControllerTest {

  private static final String USER = "user-1";

  @Mock private FolderService folderService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new FolderController(folderService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldCreateFolder() throws Exception {
    DocumentFolder folder = folder("Reports", null);
    when(folderService.createFolder(USER, "Reports", null, "#1a2b3c")).thenReturn(folder);

    mockMvc
        .perform(
            post("/api/folders")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Reports\",\"color\":\"#1a2b3c\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(folder.getId().toString()))
        .andExpect(jsonPath("$.name").value("Reports"))
        .andExpect(jsonPath("$.documentCount").value(0));
  }

  @Test
  void shouldRejectBlankFolderName() throws Exception {
    mockMvc
        .perform(
            post("/api/folders")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  void shouldRejectMalformedColor() throws Exception {
    mockMvc
        .perform(
            post("/api/folders")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Reports\",\"color\":\"red\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldReturnFolderTree() throws Exception {
    FolderTreeNode child =
        FolderTreeNode.builder().id(UUID.randomUUID()).name("Q1").depth(1).build();
    FolderTreeNode root =
        FolderTreeNode.builder()
            .id(UUID.randomUUID())
            .name("Reports")
            .documentCount(3)
            .children(List.of(child))
            .build();
    when(folderService.getFolderTree(USER)).thenReturn(List.of(root));

    mockMvc
        .perform(get("/api/folders/tree").header(ApiHeaders.USER_ID, USER))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Reports"))
        .andExpect(jsonPath("$[0].documentCount").value(3))
        .andExpect(jsonPath("$[0].children[0].name").value("Q1"));
  }

  @Test
  void shouldClampContentsPaging() throws Exception {
    when(folderService.getFolderContents(eq(USER), isNull(), anyInt(), anyInt()))
        .thenReturn(
            FolderContents.builder()
                .breadcrumb(List.of())
                .subfolders(List.of())
                .documents(List.of())
                .documentCounts(Map.of())
                .build());

    mockMvc
        .perform(
            get("/api/folders/contents")
                .param("limit", "500")
                .param("offset", "-4")
                .header(ApiHeaders.USER_ID, USER))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalDocuments").value(0));

    verify(folderService).getFolderContents(USER, null, 100, 0);
  }

  @Test
  void shouldReturnBreadcrumbRootFirst() throws Exception {
    DocumentFolder parent = folder("Reports", null);
    DocumentFolder child = folder("Q1", parent.getId());
    when(folderService.getBreadcrumb(USER, child.getId()))
        .thenReturn(List.of(BreadcrumbItem.fromEntity(parent), BreadcrumbItem.fromEntity(child)));

    mockMvc
        .perform(
            get("/api/folders/{id}/breadcrumb", child.getId()).header(ApiHeaders.USER_ID, USER))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Reports"))
        .andExpect(jsonPath("$[1].name").value("Q1"));
  }

  @Test
  void shouldReturn409_whenMoveCreatesCycle() throws Exception {
    UUID folderId = UUID.randomUUID();
    UUID descendantId = UUID.randomUUID();
    when(folderService.moveFolder(USER, folderId, descendantId))
        .thenThrow(
            new FolderCycleException(
                folderId, descendantId, "Cannot move a folder into its own subtree"));

    mockMvc
        .perform(
            put("/api/folders/{id}/parent", folderId)
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"parentId\":\"" + descendantId + "\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("FOLDER_002"));
  }

  @Test
  void shouldReturn404_whenDeletingMissingFolder() throws Exception {
    UUID folderId = UUID.randomUUID();
    doThrow(new FolderNotFoundException(folderId))
        .when(folderService)
        .deleteFolder(USER, folderId);

    mockMvc
        .perform(delete("/api/folders/{id}", folderId).header(ApiHeaders.USER_ID, USER))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("FOLDER_001"));
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
