package com.flamingo.ai.knowledge.service.worker;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result reported back to the job queue. Exactly one of {@code content} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(boolean success, String content, String error) {

  public static JobResult succeeded(String content) {
    return new JobResult(true, content, null);
  }

  public static JobResult failed(String error) {
    return new JobResult(false, null, error);
  }
}
