package com.flamingo.ai.knowledge.service.ingestion.vision;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** OCR and description of images through the vision-capable chat model. */
@Service
@Slf4j
public class ImageTranscriptionService {

  static final String PROMPT =
      "Extract ALL text content from this image using OCR. Also describe the image contents. "
          + "Format your response as:\n\n## OCR Text\n[extracted text]\n\n## Description\n"
          + "[image description]";

  private final ObjectProvider<ChatModel> visionModel;
  private final MeterRegistry meterRegistry;

  public ImageTranscriptionService(
      @Qualifier("visionChatModel") ObjectProvider<ChatModel> visionModel,
      MeterRegistry meterRegistry) {
    this.visionModel = visionModel;
    this.meterRegistry = meterRegistry;
  }

  /** Whether a vision model is configured. */
  public boolean isAvailable() {
    return visionModel.getIfAvailable() != null;
  }

  /**
   * Transcribes the text in an image and describes it.
   *
   * @param image raw image bytes
   * @param mimeType image MIME type
   * @return the model's answer, possibly empty
   * @throws IllegalStateException if no vision model is configured
   */
  @Timed(value = "vision.transcribe", description = "Time to transcribe an image")
  @CircuitBreaker(name = "openai")
  public String transcribe(byte[] image, String mimeType) {
    ChatModel model = visionModel.getIfAvailable();
    if (model == null) {
      throw new IllegalStateException("No vision model configured");
    }

    UserMessage message =
        UserMessage.from(
            TextContent.from(PROMPT),
            ImageContent.from(
                Base64.getEncoder().encodeToString(image),
                mimeType,
                ImageContent.DetailLevel.HIGH));
    ChatRequest request = ChatRequest.builder().messages(List.<ChatMessage>of(message)).build();

    ChatResponse response = model.chat(request);
    meterRegistry.counter("vision.requests.success").increment();
    AiMessage ai = response.aiMessage();
    String text = ai != null && ai.text() != null ? ai.text() : "";
    log.debug("Vision model returned {} chars", text.length());
    return text;
  }
}
