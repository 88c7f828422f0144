package com.williamcallahan.gemtext.service;

import com.williamcallahan.gemtext.config.ConverterConfig;
import com.williamcallahan.gemtext.config.GemtextProperties;
import com.williamcallahan.gemtext.domain.ConversionSummary;
import com.williamcallahan.gemtext.service.gemtext.GemtextRenderException;
import com.williamcallahan.gemtext.service.gemtext.GemtextRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts HTML files and directory trees into gemtext files.
 */
@Service
public class GemtextConversionService {

    private static final Logger log = LoggerFactory.getLogger(GemtextConversionService.class);

    private final GemtextRenderer renderer;
    private final FileOperationsService fileOperations;
    private final ConverterConfig converterConfig;

    public GemtextConversionService(GemtextRenderer renderer,
                                    FileOperationsService fileOperations,
                                    GemtextProperties properties) {
        this.renderer = renderer;
        this.fileOperations = fileOperations;
        this.converterConfig = properties.getCli();
    }

    /**
     * Converts a single HTML file.
     *
     * @param htmlFile file to convert
     * @param targetDir directory to write into, or null to write beside the input
     * @return path of the written gemtext file
     * @throws IOException when the file cannot be read or the result cannot be written
     */
    public Path convertFile(Path htmlFile, Path targetDir) throws IOException {
        byte[] html = fileOperations.readBytes(htmlFile);
        String gemtext = renderer.render(html);
        Path directory = targetDir != null ? targetDir : htmlFile.toAbsolutePath().getParent();
        Path target = directory.resolve(fileOperations.replaceExtension(htmlFile, converterConfig.getExtension()));
        fileOperations.saveTextFile(target, gemtext);
        log.debug("Converted {} -> {} ({} chars)", htmlFile, target, gemtext.length());
        return target;
    }

    /**
     * Converts a file or every HTML file below a directory. Failures of single files are
     * logged and counted; the remaining files are still converted.
     *
     * @param input file or directory
     * @return conversion counts
     */
    public ConversionSummary convert(Path input) {
        if (!fileOperations.fileExists(input)) {
            log.warn("Input not found: {}", input);
            return ConversionSummary.empty().withFailed();
        }
        Path outputRoot = configuredOutputDir();
        if (!fileOperations.isDirectory(input)) {
            return convertQuietly(input, outputRoot);
        }

        List<Path> htmlFiles;
        try {
            htmlFiles = fileOperations.listFiles(input, converterConfig.getInputExtensions());
        } catch (IOException walkFailure) {
            log.error("Failed to list {}: {}", input, walkFailure.getMessage());
            log.debug("Stack trace:", walkFailure);
            return ConversionSummary.empty().withFailed();
        }
        log.info("Converting {} HTML files under {}", htmlFiles.size(), input);

        ConversionSummary summary = ConversionSummary.empty();
        for (Path htmlFile : htmlFiles) {
            Path targetDir = null;
            if (outputRoot != null) {
                Path relativeParent = input.relativize(htmlFile).getParent();
                targetDir = relativeParent == null ? outputRoot : outputRoot.resolve(relativeParent);
            }
            summary = summary.plus(convertQuietly(htmlFile, targetDir));
        }
        return summary;
    }

    private ConversionSummary convertQuietly(Path htmlFile, Path targetDir) {
        try {
            Path target = convertFile(htmlFile, targetDir);
            log.info("Wrote {}", target);
            return ConversionSummary.empty().withConverted();
        } catch (IOException | GemtextRenderException conversionFailure) {
            log.warn("Failed to convert {}: {}", htmlFile, conversionFailure.getMessage());
            log.debug("Stack trace:", conversionFailure);
            return ConversionSummary.empty().withFailed();
        }
    }

    private Path configuredOutputDir() {
        String outputDir = converterConfig.getOutputDir();
        return outputDir.isBlank() ? null : Path.of(outputDir);
    }
}
