package com.williamcallahan.gemtext.service;

import com.williamcallahan.gemtext.support.TextNormalizer;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File system access for the document converter.
 */
@Service
public class FileOperationsService {

    /**
     * Saves text content to a file as UTF-8, creating parent directories as needed.
     *
     * @param filePath The path to the file
     * @param content The text content to write
     * @throws IOException If file operations fail
     */
    public void saveTextFile(Path filePath, String content) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Reads a file as raw bytes, leaving charset detection to the HTML parser.
     *
     * @param filePath The path to the file
     * @return The file content
     * @throws IOException If file operations fail
     */
    public byte[] readBytes(Path filePath) throws IOException {
        return Files.readAllBytes(filePath);
    }

    public boolean fileExists(Path filePath) {
        return Files.exists(filePath);
    }

    public boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    /**
     * Lists the regular files below a directory whose extension is one of the given ones.
     *
     * @param directory The directory to walk
     * @param extensions Extensions without the dot, matched case-insensitively
     * @return Matching files in path order
     * @throws IOException If the directory cannot be walked
     */
    public List<Path> listFiles(Path directory, Collection<String> extensions) throws IOException {
        Set<String> wanted = extensions.stream()
                .map(TextNormalizer::toLowerAscii)
                .collect(Collectors.toSet());
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> wanted.contains(extensionOf(path)))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Returns the file name of a path with its extension replaced.
     *
     * @param filePath The source path
     * @param extension The new extension, without the dot
     * @return The file name with the new extension
     */
    public String replaceExtension(Path filePath, String extension) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return stem + "." + extension;
    }

    private static String extensionOf(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : TextNormalizer.toLowerAscii(fileName.substring(dot + 1));
    }
}
