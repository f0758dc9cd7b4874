package com.flamingo.ai.knowledge.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledge.api.rest.DocumentController;
import com.flamingo.ai.knowledge.api.rest.FolderController;
import com.flamingo.ai.knowledge.api.rest.SearchController;
import com.flamingo.ai.knowledge.api.rest.WorkerController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests pinning the base path of every controller.
 *
 * <ul>
 *   <li>/api/documents - upload, list, detail, delete, reprocess, archive, bulk
 *   <li>/api/documents/search, /api/documents/context - retrieval
 *   <li>/api/folders - folder tree and browsing
 *   <li>/api/worker - job queue entry point
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped to /api/documents")
    void shouldBeMappedToApiDocuments() {
      RequestMapping mapping = DocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/documents");
    }
  }

  @Nested
  @DisplayName("SearchController API contract")
  class SearchControllerContract {

    @Test
    @DisplayName("should share the /api/documents prefix")
    void shouldShareDocumentsPrefix() {
      RequestMapping mapping = SearchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/documents");
    }
  }

  @Nested
  @DisplayName("FolderController API contract")
  class FolderControllerContract {

    @Test
    @DisplayName("should be mapped to /api/folders")
    void shouldBeMappedToApiFolders() {
      RequestMapping mapping = FolderController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/folders");
    }
  }

  @Nested
  @DisplayName("WorkerController API contract")
  class WorkerControllerContract {

    @Test
    @DisplayName("should be mapped to /api/worker")
    void shouldBeMappedToApiWorker() {
      RequestMapping mapping = WorkerController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/worker");
    }
  }
}
