package com.flamingo.ai.knowledge.domain.repository;

import java.util.Objects;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/** {@link Pageable} addressed by row offset rather than page number. */
public final class OffsetPageRequest implements Pageable {

  private final long offset;
  private final int limit;
  private final Sort sort;

  public OffsetPageRequest(long offset, int limit, Sort sort) {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset must not be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("Limit must be at least 1");
    }
    this.offset = offset;
    this.limit = limit;
    this.sort = sort != null ? sort : Sort.unsorted();
  }

  @Override
  public int getPageNumber() {
    return (int) (offset / limit);
  }

  @Override
  public int getPageSize() {
    return limit;
  }

  @Override
  public long getOffset() {
    return offset;
  }

  @Override
  public Sort getSort() {
    return sort;
  }

  @Override
  public Pageable next() {
    return new OffsetPageRequest(offset + limit, limit, sort);
  }

  @Override
  public Pageable previousOrFirst() {
    return hasPrevious()
        ? new OffsetPageRequest(Math.max(0, offset - limit), limit, sort)
        : first();
  }

  @Override
  public Pageable first() {
    return new OffsetPageRequest(0, limit, sort);
  }

  @Override
  public Pageable withPage(int pageNumber) {
    return new OffsetPageRequest((long) pageNumber * limit, limit, sort);
  }

  @Override
  public boolean hasPrevious() {
    return offset > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OffsetPageRequest other)) {
      return false;
    }
    return offset == other.offset && limit == other.limit && sort.equals(other.sort);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, limit, sort);
  }
}
