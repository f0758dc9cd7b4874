package com.flamingo.ai.knowledge.service.storage;

/** Object store holding the original bytes of uploaded documents. */
public interface BlobStorage {

  /**
   * Writes an object, replacing any existing object at the same path.
   *
   * @param path the object path, relative to the store root
   * @param content the bytes to store
   * @param contentType the MIME type recorded for the object
   * @throws com.flamingo.ai.knowledge.exception.MimeTypeRejectedException if the store's content
   *     type policy refuses {@code contentType}
   * @throws com.flamingo.ai.knowledge.exception.StorageException if the write fails
   */
  void put(String path, byte[] content, String contentType);

  /**
   * Reads an object.
   *
   * @throws com.flamingo.ai.knowledge.exception.StorageException if the object is missing or
   *     unreadable
   */
  byte[] get(String path);

  /** Deletes an object. Deleting a missing object is not an error. */
  void delete(String path);
}
