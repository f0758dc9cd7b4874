package com.flamingo.ai.knowledge.api.rest;

import com.flamingo.ai.knowledge.api.dto.request.DocumentJobRequest;
import com.flamingo.ai.knowledge.service.worker.DocumentJob;
import com.flamingo.ai.knowledge.service.worker.DocumentJobWorker;
import com.flamingo.ai.knowledge.service.worker.JobResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Entry point for the external job queue. */
@RestController
@RequestMapping("/api/worker")
@RequiredArgsConstructor
public class WorkerController {

  private final DocumentJobWorker documentJobWorker;

  /** Processes a document synchronously and reports the outcome. */
  @PostMapping("/documents")
  public ResponseEntity<JobResult> processDocument(
      @Valid @RequestBody DocumentJobRequest request) {
    return ResponseEntity.ok(
        documentJobWorker.process(new DocumentJob(request.getDocumentId())));
  }
}
