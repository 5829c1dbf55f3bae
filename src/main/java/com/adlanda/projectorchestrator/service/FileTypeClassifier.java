package com.adlanda.projectorchestrator.service;

import com.adlanda.projectorchestrator.model.FileType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Classifies files by extension, falling back to a content sniff for small files.
 */
@Component
public class FileTypeClassifier {

    static final long SNIFF_LIMIT_BYTES = 1024 * 1024;
    private static final int SNIFF_SAMPLE_BYTES = 1024;

    static final Set<String> SOURCE_EXTENSIONS = Set.of(
            "py", "js", "ts", "jsx", "tsx", "java", "c", "cpp", "h", "hpp",
            "cs", "php", "rb", "go", "rs", "swift", "kt", "scala", "clj",
            "hs", "ml", "fs", "vb", "pl", "sh", "bash", "zsh", "fish",
            "ps1", "bat", "cmd", "r", "m", "mm", "sql", "html", "htm",
            "css", "scss", "sass", "less", "xml", "json", "yaml", "yml",
            "toml", "ini", "cfg", "conf", "md", "rst", "tex", "vue"
    );

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("py", "python"), Map.entry("js", "javascript"), Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"), Map.entry("tsx", "typescript"), Map.entry("java", "java"),
            Map.entry("c", "c"), Map.entry("h", "c"), Map.entry("cpp", "cpp"), Map.entry("hpp", "cpp"),
            Map.entry("cs", "csharp"), Map.entry("php", "php"), Map.entry("rb", "ruby"),
            Map.entry("go", "go"), Map.entry("rs", "rust"), Map.entry("swift", "swift"),
            Map.entry("kt", "kotlin"), Map.entry("scala", "scala"), Map.entry("r", "r"),
            Map.entry("sql", "sql"), Map.entry("html", "html"), Map.entry("htm", "html"),
            Map.entry("css", "css"), Map.entry("scss", "scss"), Map.entry("xml", "xml"),
            Map.entry("json", "json"), Map.entry("yaml", "yaml"), Map.entry("yml", "yaml"),
            Map.entry("md", "markdown"), Map.entry("sh", "bash"), Map.entry("bash", "bash")
    );

    private static final Map<String, FileType> KNOWN_TYPES = Map.ofEntries(
            Map.entry("txt", FileType.TEXT), Map.entry("csv", FileType.TEXT), Map.entry("tsv", FileType.TEXT),
            Map.entry("properties", FileType.TEXT),
            Map.entry("png", FileType.IMAGE), Map.entry("jpg", FileType.IMAGE), Map.entry("jpeg", FileType.IMAGE),
            Map.entry("gif", FileType.IMAGE), Map.entry("bmp", FileType.IMAGE), Map.entry("svg", FileType.IMAGE),
            Map.entry("ico", FileType.IMAGE), Map.entry("webp", FileType.IMAGE),
            Map.entry("pdf", FileType.DOCUMENT), Map.entry("doc", FileType.DOCUMENT), Map.entry("docx", FileType.DOCUMENT),
            Map.entry("odt", FileType.DOCUMENT), Map.entry("rtf", FileType.DOCUMENT),
            Map.entry("zip", FileType.ARCHIVE), Map.entry("tar", FileType.ARCHIVE), Map.entry("gz", FileType.ARCHIVE),
            Map.entry("tgz", FileType.ARCHIVE), Map.entry("rar", FileType.ARCHIVE), Map.entry("7z", FileType.ARCHIVE),
            Map.entry("jar", FileType.ARCHIVE),
            Map.entry("exe", FileType.BINARY), Map.entry("dll", FileType.BINARY), Map.entry("so", FileType.BINARY),
            Map.entry("o", FileType.BINARY), Map.entry("class", FileType.BINARY), Map.entry("pyc", FileType.BINARY),
            Map.entry("bin", FileType.BINARY)
    );

    /**
     * Detects the type of a regular file.
     *
     * @param file Path to the file
     * @param size Size of the file in bytes
     * @throws IOException if the file has to be sniffed and cannot be read
     */
    public FileType classify(Path file, long size) throws IOException {
        String extension = extensionOf(file);
        if (SOURCE_EXTENSIONS.contains(extension)) {
            return FileType.SOURCE_CODE;
        }
        FileType known = KNOWN_TYPES.get(extension);
        if (known != null) {
            return known;
        }
        if (size >= SNIFF_LIMIT_BYTES) {
            return FileType.UNKNOWN;
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] sample = in.readNBytes(SNIFF_SAMPLE_BYTES);
            for (byte b : sample) {
                if (b == 0) {
                    return FileType.BINARY;
                }
            }
            return FileType.TEXT;
        }
    }

    /**
     * Language of a source file, or null when the extension is not mapped.
     */
    public String languageOf(Path file) {
        return LANGUAGES.get(extensionOf(file));
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
