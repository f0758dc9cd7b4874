package com.flamingo.ai.knowledge.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.DocumentScope;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.exception.GlobalExceptionHandler;
import com.flamingo.ai.knowledge.service.search.ConversationContext;
import com.flamingo.ai.knowledge.service.search.DocumentSearchService;
import com.flamingo.ai.knowledge.service.search.SearchOptions;
import com.flamingo.ai.knowledge.service.search.SearchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SearchControllerTest {

  private static final String USER = "user-1";

  @Mock private DocumentSearchService documentSearchService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(documentSearchService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  void shouldSearchWithRequestedOptions() throws Exception {
    UUID documentId = UUID.randomUUID();
    SearchResult result =
        new SearchResult(
            documentId + "_0",
            documentId,
            "handbook.pdf",
            FileType.PDF,
            "Vacation policy",
            ChunkType.TEXT,
            3,
            0.82,
            Map.of());
    when(documentSearchService.searchDocuments(eq(USER), eq("vacation"), any()))
        .thenReturn(List.of(result));

    mockMvc
        .perform(
            post("/api/documents/search")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"query\":\"vacation\",\"limit\":5,\"minSimilarity\":0.5,"
                        + "\"scope\":\"CONVERSATION\",\"threadId\":\"t-1\","
                        + "\"fileTypes\":[\"PDF\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].documentName").value("handbook.pdf"))
        .andExpect(jsonPath("$[0].sourcePage").value(3))
        .andExpect(jsonPath("$[0].similarity").value(0.82));

    ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
    verify(documentSearchService).searchDocuments(eq(USER), eq("vacation"), options.capture());
    assertThat(options.getValue().limit()).isEqualTo(5);
    assertThat(options.getValue().minSimilarity()).isEqualTo(0.5);
    assertThat(options.getValue().scope()).isEqualTo(DocumentScope.CONVERSATION);
    assertThat(options.getValue().threadId()).isEqualTo("t-1");
    assertThat(options.getValue().fileTypes()).containsExactly(FileType.PDF);
  }

  @Test
  void shouldRejectBlankQuery() throws Exception {
    mockMvc
        .perform(
            post("/api/documents/search")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verifyNoInteractions(documentSearchService);
  }

  @Test
  void shouldRejectLimitAboveMaximum() throws Exception {
    mockMvc
        .perform(
            post("/api/documents/search")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"vacation\",\"limit\":500}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(documentSearchService);
  }

  @Test
  void shouldBuildConversationContextWithDefaultBudget() throws Exception {
    UUID documentId = UUID.randomUUID();
    ConversationContext context =
        new ConversationContext(
            "[handbook.pdf]\nVacation policy",
            List.of(
                new ConversationContext.Source(
                    documentId + "_0", documentId, "handbook.pdf", 0.9, 12)));
    when(documentSearchService.getConversationContext(USER, "t-1", "vacation", 0))
        .thenReturn(context);

    mockMvc
        .perform(
            post("/api/documents/context")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"threadId\":\"t-1\",\"query\":\"vacation\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content").value("[handbook.pdf]\nVacation policy"))
        .andExpect(jsonPath("$.sources[0].cumulativeTokens").value(12));
  }

  @Test
  void shouldRequireThreadIdForContext() throws Exception {
    mockMvc
        .perform(
            post("/api/documents/context")
                .header(ApiHeaders.USER_ID, USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"vacation\"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(documentSearchService);
  }
}
