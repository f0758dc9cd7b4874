package com.flamingo.ai.knowledge.api.rest;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.knowledge.exception.GlobalExceptionHandler;
import com.flamingo.ai.knowledge.service.worker.DocumentJob;
import com.flamingo.ai.knowledge.service.worker.DocumentJobWorker;
import com.flamingo.ai.knowledge.service.worker.JobResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
class WorkerControllerTest {

  @Mock private DocumentJobWorker documentJobWorker;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new WorkerController(documentJobWorker))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldReportSuccessWithoutErrorField() throws Exception {
    UUID documentId = UUID.randomUUID();
    when(documentJobWorker.process(new DocumentJob(documentId)))
        .thenReturn(JobResult.succeeded("Processed 4 chunks"));

    mockMvc
        .perform(
            post("/api/worker/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documentId\":\"" + documentId + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.content").value("Processed 4 chunks"))
        .andExpect(jsonPath("$.error").doesNotExist());
  }

  @Test
  void shouldReportFailureAsPayload() throws Exception {
    UUID documentId = UUID.randomUUID();
    when(documentJobWorker.process(new DocumentJob(documentId)))
        .thenReturn(JobResult.failed("Document not found"));

    mockMvc
        .perform(
            post("/api/worker/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documentId\":\"" + documentId + "\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error").value("Document not found"))
        .andExpect(jsonPath("$.content").doesNotExist());
  }

  @Test
  void shouldRejectJobWithoutDocumentId() throws Exception {
    mockMvc
        .perform(
            post("/api/worker/documents").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(documentJobWorker);
  }
}
