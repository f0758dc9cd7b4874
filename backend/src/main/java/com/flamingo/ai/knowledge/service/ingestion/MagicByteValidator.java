package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks that the leading bytes of an upload match the format its type claims, so renamed or
 * spoofed files are rejected before they reach storage or a parser.
 */
@Component
@Slf4j
public class MagicByteValidator {

  private static final byte[] PDF = {0x25, 0x50, 0x44, 0x46};
  private static final byte[] ZIP = {0x50, 0x4B, 0x03, 0x04};
  private static final byte[] OLE2 = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0};
  private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47};
  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
  private static final byte[] GIF = {0x47, 0x49, 0x46, 0x38};
  private static final byte[] RIFF = {0x52, 0x49, 0x46, 0x46};
  private static final byte[] WEBP = {0x57, 0x45, 0x42, 0x50};

  static final int NULL_SCAN_BYTES = 1024;
  static final int MAX_NULL_BYTES = 2;
  static final int UTF8_SAMPLE_BYTES = 8192;

  public boolean validate(byte[] content, FileType expectedType) {
    if (content == null || content.length == 0 || expectedType == null) {
      return false;
    }
    return switch (expectedType) {
      case PDF -> startsWith(content, PDF, 0);
      case DOCX, XLSX, PPTX -> startsWith(content, ZIP, 0);
      case DOC, XLS, PPT -> startsWith(content, OLE2, 0);
      case IMAGE -> isImage(content);
      case TXT, MD, CSV, JSON, CODE -> isText(content);
      case OTHER -> false;
    };
  }

  /** Human readable name of the format a type is checked against, for rejection messages. */
  public String describe(FileType type) {
    return switch (type) {
      case PDF -> "PDF";
      case DOCX -> "Word (DOCX)";
      case DOC -> "Word (DOC)";
      case XLSX -> "Excel (XLSX)";
      case XLS -> "Excel (XLS)";
      case PPTX -> "PowerPoint (PPTX)";
      case PPT -> "PowerPoint (PPT)";
      case IMAGE -> "image";
      case TXT, MD, CSV, JSON, CODE -> "UTF-8 text";
      case OTHER -> "supported";
    };
  }

  private boolean isImage(byte[] content) {
    if (startsWith(content, PNG, 0)
        || startsWith(content, JPEG, 0)
        || startsWith(content, GIF, 0)) {
      return true;
    }
    if (startsWith(content, RIFF, 0) && startsWith(content, WEBP, 8)) {
      return true;
    }
    return isSvg(content);
  }

  private boolean isSvg(byte[] content) {
    int length = Math.min(content.length, NULL_SCAN_BYTES);
    String head = new String(content, 0, length, StandardCharsets.UTF_8);
    if (head.startsWith("\uFEFF")) {
      head = head.substring(1);
    }
    head = head.stripLeading().toLowerCase(Locale.ROOT);
    return head.startsWith("<svg") || (head.startsWith("<?xml") && head.contains("<svg"));
  }

  private boolean isText(byte[] content) {
    int scan = Math.min(content.length, NULL_SCAN_BYTES);
    int nulls = 0;
    for (int i = 0; i < scan; i++) {
      if (content[i] == 0) {
        nulls++;
      }
    }
    if (nulls > MAX_NULL_BYTES) {
      log.debug("Rejecting text upload with {} null bytes in the first {} bytes", nulls, scan);
      return false;
    }

    int sampleLength = Math.min(content.length, UTF8_SAMPLE_BYTES);
    boolean truncated = sampleLength < content.length;
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    ByteBuffer in = ByteBuffer.wrap(content, 0, sampleLength);
    CharBuffer out = CharBuffer.allocate(sampleLength);
    // a multi-byte sequence cut by the sample boundary is an underflow, not an error
    CoderResult result = decoder.decode(in, out, !truncated);
    if (result.isError()) {
      return false;
    }
    if (!truncated) {
      return !decoder.flush(out).isError();
    }
    return true;
  }

  private static boolean startsWith(byte[] content, byte[] signature, int offset) {
    if (content.length < offset + signature.length) {
      return false;
    }
    for (int i = 0; i < signature.length; i++) {
      if (content[offset + i] != signature[i]) {
        return false;
      }
    }
    return true;
  }
}
