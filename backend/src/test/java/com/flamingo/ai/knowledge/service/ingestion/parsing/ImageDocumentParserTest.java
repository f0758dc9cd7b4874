package com.flamingo.ai.knowledge.service.ingestion.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import com.flamingo.ai.knowledge.domain.enums.FileType;
import com.flamingo.ai.knowledge.service.ingestion.chunking.TextChunker;
import com.flamingo.ai.knowledge.service.ingestion.vision.ImageTranscriptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImageDocumentParserTest {

  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00};

  @Mock private ImageTranscriptionService transcriptionService;

  private ImageDocumentParser parser;

  @BeforeEach
  void setUp() {
    parser = new ImageDocumentParser(transcriptionService, new TextChunker(new KnowledgeConfig()));
  }

  @Test
  void shouldStorePlaceholder_whenNoVisionModel() {
    when(transcriptionService.isAvailable()).thenReturn(false);

    ParsedDocument parsed = parser.parse(JPEG, FileType.IMAGE, "photo.jpg");

    assertThat(parsed.content()).isEqualTo(ImageDocumentParser.NO_OCR_PLACEHOLDER);
    assertThat(parsed.chunks()).isEmpty();
    assertThat(parsed.metadata()).containsEntry("ocrAvailable", false);
    verify(transcriptionService, never()).transcribe(any(), anyString());
  }

  @Test
  void shouldChunkTranscription_whenVisionAvailable() {
    when(transcriptionService.isAvailable()).thenReturn(true);
    when(transcriptionService.transcribe(any(), eq("image/jpeg")))
        .thenReturn("## OCR Text\nInvoice 42\n\n## Description\nA scanned invoice");

    ParsedDocument parsed = parser.parse(JPEG, FileType.IMAGE, "scan.jpg");

    assertThat(parsed.chunks()).hasSize(1);
    assertThat(parsed.chunks().get(0).chunkType()).isEqualTo(ChunkType.TEXT);
    assertThat(parsed.chunks().get(0).content()).contains("Invoice 42");
    assertThat(parsed.metadata())
        .containsEntry("mimeType", "image/jpeg")
        .containsEntry("ocrAvailable", true);
  }

  @Test
  void shouldDegradeToPlaceholder_whenTranscriptionFails() {
    when(transcriptionService.isAvailable()).thenReturn(true);
    when(transcriptionService.transcribe(any(), anyString()))
        .thenThrow(new IllegalStateException("rate limited"));

    ParsedDocument parsed = parser.parse(JPEG, FileType.IMAGE, "scan.jpg");

    assertThat(parsed.content()).isEqualTo(ImageDocumentParser.OCR_FAILED_PLACEHOLDER);
    assertThat(parsed.chunks()).isEmpty();
    assertThat(parsed.metadata()).containsEntry("error", "rate limited");
  }

  @Test
  void shouldSniffMimeTypeFromSignature() {
    assertThat(ImageDocumentParser.sniffMimeType(new byte[] {0x47, 0x49, 0x46}))
        .isEqualTo("image/gif");
    assertThat(ImageDocumentParser.sniffMimeType(new byte[] {(byte) 0x89, 0x50}))
        .isEqualTo("image/png");
    assertThat(ImageDocumentParser.sniffMimeType("<svg/>".getBytes())).isEqualTo("image/svg+xml");
  }
}
