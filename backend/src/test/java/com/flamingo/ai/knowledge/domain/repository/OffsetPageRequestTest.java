package com.flamingo.ai.knowledge.domain.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

class OffsetPageRequestTest {

  @Test
  void shouldKeepOffsetThatIsNotAPageMultiple() {
    OffsetPageRequest pageable = new OffsetPageRequest(15, 10, Sort.by("name"));

    assertThat(pageable.getOffset()).isEqualTo(15);
    assertThat(pageable.getPageSize()).isEqualTo(10);
    assertThat(pageable.getPageNumber()).isEqualTo(1);
    assertThat(pageable.getSort()).isEqualTo(Sort.by("name"));
  }

  @Test
  void shouldStepByLimit() {
    OffsetPageRequest pageable = new OffsetPageRequest(15, 10, null);

    Pageable next = pageable.next();
    Pageable previous = pageable.previousOrFirst();

    assertThat(next.getOffset()).isEqualTo(25);
    assertThat(previous.getOffset()).isEqualTo(5);
    assertThat(previous.previousOrFirst().getOffset()).isZero();
    assertThat(pageable.first().hasPrevious()).isFalse();
    assertThat(pageable.getSort().isUnsorted()).isTrue();
  }

  @Test
  void shouldRejectInvalidBounds() {
    assertThatThrownBy(() -> new OffsetPageRequest(-1, 10, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new OffsetPageRequest(0, 0, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldCompareByValue() {
    assertThat(new OffsetPageRequest(5, 10, Sort.unsorted()))
        .isEqualTo(new OffsetPageRequest(5, 10, null))
        .hasSameHashCodeAs(new OffsetPageRequest(5, 10, null));
  }
}
