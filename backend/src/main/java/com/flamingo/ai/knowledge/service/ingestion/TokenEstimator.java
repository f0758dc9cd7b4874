package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.domain.enums.ChunkType;
import org.springframework.stereotype.Component;

/**
 * Estimates model tokens from characters without a tokenizer.
 *
 * <p>Text that is more than 30% CJK is costed at 1.5 characters per CJK token and 4 per other
 * token. Otherwise the ratio depends on the chunk type: code 3.5, tables and metadata 3.0, prose
 * 4.0, and the CJK blend acts as a floor so the estimate never drops as text grows.
 */
@Component
public class TokenEstimator {

  private static final double CJK_DOMINANCE = 0.3;
  private static final double CJK_CHARS_PER_TOKEN = 1.5;
  private static final double TEXT_CHARS_PER_TOKEN = 4.0;
  private static final double CODE_CHARS_PER_TOKEN = 3.5;
  private static final double STRUCTURED_CHARS_PER_TOKEN = 3.0;

  public int estimate(String text, ChunkType chunkType) {
    if (text == null || text.isEmpty()) {
      return 0;
    }

    int length = text.codePointCount(0, text.length());
    long cjk = text.codePoints().filter(TokenEstimator::isCjk).count();
    int blended =
        (int) Math.ceil(cjk / CJK_CHARS_PER_TOKEN + (length - cjk) / TEXT_CHARS_PER_TOKEN);
    if (cjk > length * CJK_DOMINANCE) {
      return blended;
    }

    double ratio;
    if (chunkType == ChunkType.CODE) {
      ratio = CODE_CHARS_PER_TOKEN;
    } else if (chunkType == ChunkType.TABLE || chunkType == ChunkType.METADATA) {
      ratio = STRUCTURED_CHARS_PER_TOKEN;
    } else {
      ratio = TEXT_CHARS_PER_TOKEN;
    }
    // above the threshold the blend is always the larger of the two
    return Math.max(blended, (int) Math.ceil(length / ratio));
  }

  static boolean isCjk(int codePoint) {
    return (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
        || (codePoint >= 0x3400 && codePoint <= 0x4DBF)
        || (codePoint >= 0x20000 && codePoint <= 0x2A6DF)
        || (codePoint >= 0x2A700 && codePoint <= 0x2B73F)
        || (codePoint >= 0x3040 && codePoint <= 0x309F) // hiragana
        || (codePoint >= 0x30A0 && codePoint <= 0x30FF) // katakana
        || (codePoint >= 0xAC00 && codePoint <= 0xD7AF); // hangul
  }
}
