package com.flamingo.ai.knowledge.service.storage;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.exception.MimeTypeRejectedException;
import com.flamingo.ai.knowledge.exception.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link BlobStorage} on the local filesystem under {@code knowledge.storage.base-path}.
 *
 * <p>When {@code knowledge.storage.allowed-content-types} is non-empty, writes with any other
 * content type are refused with {@link MimeTypeRejectedException}, the way a bucket MIME policy
 * behaves.
 */
@Service
@Slf4j
public class LocalBlobStorage implements BlobStorage {

  private final Path root;
  private final List<String> allowedContentTypes;

  public LocalBlobStorage(KnowledgeConfig knowledgeConfig) {
    this.root = Path.of(knowledgeConfig.getStorage().getBasePath()).toAbsolutePath().normalize();
    this.allowedContentTypes =
        knowledgeConfig.getStorage().getAllowedContentTypes().stream()
            .map(type -> type.toLowerCase(Locale.ROOT))
            .toList();
  }

  @Override
  public void put(String path, byte[] content, String contentType) {
    if (!isAllowed(contentType)) {
      throw new MimeTypeRejectedException(contentType);
    }
    Path target = resolve(path);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, content);
      log.debug("Stored {} bytes at {} ({})", content.length, path, contentType);
    } catch (IOException e) {
      throw new StorageException("Failed to store file: " + e.getMessage(), e);
    }
  }

  @Override
  public byte[] get(String path) {
    try {
      return Files.readAllBytes(resolve(path));
    } catch (NoSuchFileException e) {
      throw new StorageException("Failed to download file: " + path + " does not exist", e);
    } catch (IOException e) {
      throw new StorageException("Failed to download file: " + e.getMessage(), e);
    }
  }

  @Override
  public void delete(String path) {
    try {
      if (Files.deleteIfExists(resolve(path))) {
        log.debug("Deleted {}", path);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to delete file: " + e.getMessage(), e);
    }
  }

  private boolean isAllowed(String contentType) {
    if (allowedContentTypes.isEmpty()) {
      return true;
    }
    return contentType != null
        && allowedContentTypes.contains(contentType.toLowerCase(Locale.ROOT));
  }

  private Path resolve(String path) {
    Path target = root.resolve(path).normalize();
    if (!target.startsWith(root)) {
      throw new StorageException("Invalid storage path: " + path);
    }
    return target;
  }
}
