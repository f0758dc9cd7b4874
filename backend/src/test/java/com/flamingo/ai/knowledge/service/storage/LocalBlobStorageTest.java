package com.flamingo.ai.knowledge.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.MimeTypeRejectedException;
import com.flamingo.ai.knowledge.exception.StorageException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalBlobStorageTest {

  @TempDir Path tempDir;

  @Test
  void shouldStoreReadAndDelete() {
    LocalBlobStorage storage = storage(List.of());
    byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

    storage.put("user-1/1_notes.txt", content, "text/plain");

    assertThat(storage.get("user-1/1_notes.txt")).isEqualTo(content);
    assertThat(Files.exists(tempDir.resolve("user-1/1_notes.txt"))).isTrue();

    storage.delete("user-1/1_notes.txt");
    storage.delete("user-1/1_notes.txt");

    assertThat(Files.exists(tempDir.resolve("user-1/1_notes.txt"))).isFalse();
  }

  @Test
  void shouldFailToReadMissingObject() {
    LocalBlobStorage storage = storage(List.of());

    assertThatThrownBy(() -> storage.get("user-1/missing.pdf"))
        .isInstanceOf(StorageException.class)
        .hasMessageStartingWith("Failed to download file");
  }

  @Test
  void shouldRejectContentTypeOutsidePolicy() {
    LocalBlobStorage storage = storage(List.of("application/PDF", "application/octet-stream"));

    storage.put("u/a.pdf", new byte[] {1}, "application/pdf");
    storage.put("u/b.bin", new byte[] {1}, "application/octet-stream");

    assertThatThrownBy(() -> storage.put("u/c.md", new byte[] {1}, "text/markdown"))
        .isInstanceOf(MimeTypeRejectedException.class);
    assertThat(Files.exists(tempDir.resolve("u/c.md"))).isFalse();
  }

  @Test
  void shouldRejectPathEscapingRoot() {
    LocalBlobStorage storage = storage(List.of());

    assertThatThrownBy(() -> storage.put("../outside.txt", new byte[] {1}, "text/plain"))
        .isInstanceOf(StorageException.class)
        .hasMessageStartingWith("Invalid storage path");
  }

  private LocalBlobStorage storage(List<String> allowedContentTypes) {
    KnowledgeConfig config = new KnowledgeConfig();
    config.getStorage().setBasePath(tempDir.toString());
    config.getStorage().setAllowedContentTypes(allowedContentTypes);
    return new LocalBlobStorage(config);
  }
}
