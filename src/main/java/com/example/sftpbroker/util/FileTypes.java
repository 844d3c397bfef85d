package com.example.sftpbroker.util;

import com.example.sftpbroker.domain.entity.FileEntry;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static java.util.Map.entry;

/**
 * Static extension tables: syntax-highlighting language, listing filter categories and
 * download content types.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class FileTypes {

  public static final String DEFAULT_LANGUAGE = "text";

  public static final String FILTER_IMAGES = "images";
  public static final String FILTER_DOCUMENTS = "documents";
  public static final String FILTER_ARCHIVES = "archives";
  public static final String FILTER_CODE = "code";

  private static final Map<String, String> LANGUAGES = Map.ofEntries(
      entry("js", "javascript"), entry("jsx", "jsx"), entry("ts", "typescript"), entry("tsx", "tsx"),
      entry("py", "python"), entry("go", "go"), entry("java", "java"),
      entry("c", "c"), entry("h", "c"), entry("cpp", "cpp"), entry("cc", "cpp"), entry("cxx", "cpp"),
      entry("hpp", "cpp"), entry("cs", "csharp"), entry("php", "php"), entry("rb", "ruby"),
      entry("rs", "rust"), entry("swift", "swift"), entry("kt", "kotlin"), entry("scala", "scala"),
      entry("sh", "bash"), entry("bash", "bash"), entry("zsh", "bash"), entry("fish", "bash"),
      entry("ps1", "powershell"), entry("sql", "sql"), entry("html", "html"), entry("htm", "html"),
      entry("xml", "xml"), entry("css", "css"), entry("scss", "scss"), entry("sass", "sass"),
      entry("less", "less"), entry("json", "json"), entry("yaml", "yaml"), entry("yml", "yaml"),
      entry("toml", "toml"), entry("ini", "ini"), entry("conf", "ini"), entry("cfg", "ini"),
      entry("md", "markdown"), entry("markdown", "markdown"), entry("tex", "latex"), entry("r", "r"),
      entry("m", "matlab"), entry("pl", "perl"), entry("lua", "lua"), entry("vim", "vim"),
      entry("dockerfile", "dockerfile"), entry("docker", "dockerfile"), entry("makefile", "makefile"),
      entry("mk", "makefile"), entry("cmake", "cmake"), entry("gradle", "gradle"),
      entry("groovy", "groovy"), entry("clj", "clojure"), entry("elm", "elm"), entry("ex", "elixir"),
      entry("exs", "elixir"), entry("erl", "erlang"), entry("hrl", "erlang"), entry("fs", "fsharp"),
      entry("fsx", "fsharp"), entry("ml", "ocaml"), entry("mli", "ocaml"), entry("hs", "haskell"),
      entry("lhs", "haskell"), entry("dart", "dart"), entry("v", "verilog"),
      entry("sv", "systemverilog"), entry("vhd", "vhdl"), entry("vhdl", "vhdl"));

  private static final Set<String> IMAGES =
      Set.of("jpg", "jpeg", "png", "gif", "bmp", "svg", "webp", "ico", "tiff", "tif");
  private static final Set<String> DOCUMENTS =
      Set.of("pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "rtf", "odt", "ods", "odp");
  private static final Set<String> ARCHIVES =
      Set.of("zip", "tar", "gz", "tgz", "bz2", "xz", "7z", "rar");

  /**
   * Language for syntax highlighting, from the file extension alone.
   */
  public static String languageOf(String fileName) {
    return LANGUAGES.getOrDefault(extension(fileName), DEFAULT_LANGUAGE);
  }

  public static boolean isImage(String fileName) {
    return IMAGES.contains(extension(fileName));
  }

  public static boolean isDocument(String fileName) {
    return DOCUMENTS.contains(extension(fileName));
  }

  public static boolean isArchive(String fileName) {
    return ARCHIVES.contains(extension(fileName));
  }

  public static boolean isCode(String fileName) {
    return LANGUAGES.containsKey(extension(fileName));
  }

  /**
   * Listing filter from a user-supplied keyword: one of the category names, otherwise a
   * case-insensitive substring of the entry name. A blank filter matches everything.
   */
  public static Predicate<FileEntry> filterFor(String filter) {
    if (!StringUtils.hasText(filter)) {
      return entry -> true;
    }
    String keyword = filter.trim().toLowerCase(Locale.ROOT);
    return switch (keyword) {
      case FILTER_IMAGES -> entry -> isImage(entry.name());
      case FILTER_DOCUMENTS -> entry -> isDocument(entry.name());
      case FILTER_ARCHIVES -> entry -> isArchive(entry.name());
      case FILTER_CODE -> entry -> isCode(entry.name());
      default -> entry -> entry.name().toLowerCase(Locale.ROOT).contains(keyword);
    };
  }

  public static MediaType contentTypeOf(String fileName) {
    return MediaTypeFactory.getMediaType(fileName).orElse(MediaType.APPLICATION_OCTET_STREAM);
  }

  private static String extension(String fileName) {
    String extension = StringUtils.getFilenameExtension(fileName);
    return extension == null ? "" : extension.toLowerCase(Locale.ROOT);
  }
}
