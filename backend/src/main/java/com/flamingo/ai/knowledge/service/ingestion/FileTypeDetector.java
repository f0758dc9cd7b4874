package com.flamingo.ai.knowledge.service.ingestion;

import com.flamingo.ai.knowledge.domain.enums.FileType;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Classifies an upload into a {@link FileType} from its declared MIME type and file name.
 *
 * <p>An exact MIME match wins, then the code-extension set, then the extension table. Anything
 * else is {@link FileType#OTHER}. Never throws.
 */
@Component
public class FileTypeDetector {

  private static final Map<String, FileType> MIME_TYPES =
      Map.ofEntries(
          Map.entry("application/pdf", FileType.PDF),
          Map.entry(
              "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
              FileType.DOCX),
          Map.entry("application/msword", FileType.DOC),
          Map.entry("text/markdown", FileType.MD),
          Map.entry("text/csv", FileType.CSV),
          Map.entry("application/json", FileType.JSON),
          Map.entry(
              "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", FileType.XLSX),
          Map.entry("application/vnd.ms-excel", FileType.XLS),
          Map.entry(
              "application/vnd.openxmlformats-officedocument.presentationml.presentation",
              FileType.PPTX),
          Map.entry("application/vnd.ms-powerpoint", FileType.PPT));

  private static final Set<String> CODE_EXTENSIONS =
      Set.of(
          "js", "ts", "jsx", "tsx", "py", "rb", "go", "rs", "java", "c", "cpp", "h", "cs", "php",
          "swift", "kt", "scala", "sh", "bash", "zsh", "sql", "html", "css", "scss", "sass",
          "less", "vue", "svelte", "yaml", "yml", "toml", "xml", "graphql", "prisma", "tf",
          "dockerfile");

  private static final Map<String, FileType> EXTENSIONS =
      Map.ofEntries(
          Map.entry("pdf", FileType.PDF),
          Map.entry("docx", FileType.DOCX),
          Map.entry("doc", FileType.DOC),
          Map.entry("txt", FileType.TXT),
          Map.entry("md", FileType.MD),
          Map.entry("csv", FileType.CSV),
          Map.entry("json", FileType.JSON),
          Map.entry("xlsx", FileType.XLSX),
          Map.entry("xls", FileType.XLS),
          Map.entry("pptx", FileType.PPTX),
          Map.entry("ppt", FileType.PPT),
          Map.entry("png", FileType.IMAGE),
          Map.entry("jpg", FileType.IMAGE),
          Map.entry("jpeg", FileType.IMAGE),
          Map.entry("gif", FileType.IMAGE),
          Map.entry("webp", FileType.IMAGE),
          Map.entry("svg", FileType.IMAGE));

  public FileType detect(String mimeType, String fileName) {
    String mime = mimeType == null ? "" : mimeType.trim().toLowerCase(Locale.ROOT);
    String ext = extensionOf(fileName);

    if ("text/plain".equals(mime)) {
      return "md".equals(ext) ? FileType.MD : FileType.TXT;
    }
    FileType byMime = MIME_TYPES.get(mime);
    if (byMime != null) {
      return byMime;
    }
    if (mime.startsWith("image/")) {
      return FileType.IMAGE;
    }

    if (CODE_EXTENSIONS.contains(ext)) {
      return FileType.CODE;
    }
    return EXTENSIONS.getOrDefault(ext, FileType.OTHER);
  }

  /**
   * Lower-cased text after the last dot, or the whole name when there is no dot (so a file named
   * {@code Dockerfile} yields {@code dockerfile}).
   */
  public static String extensionOf(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return "";
    }
    int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
    String base = fileName.substring(slash + 1);
    int dot = base.lastIndexOf('.');
    return base.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
