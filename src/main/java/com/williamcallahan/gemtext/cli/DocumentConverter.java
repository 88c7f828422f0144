package com.williamcallahan.gemtext.cli;

import com.williamcallahan.gemtext.domain.ConversionSummary;
import com.williamcallahan.gemtext.service.GemtextConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Converts the HTML files and directories named on the command line into gemtext files.
 *
 * <p>Spring style {@code --name=value} options are left to the property binder and are
 * not treated as inputs.</p>
 */
@Component
public class DocumentConverter implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DocumentConverter.class);

    private static final String OPTION_PREFIX = "--";

    private final GemtextConversionService conversionService;

    public DocumentConverter(GemtextConversionService conversionService) {
        this.conversionService = conversionService;
    }

    @Override
    public void run(String... args) {
        List<Path> inputs = inputPaths(args);
        if (inputs.isEmpty()) {
            log.info("Usage: html2gemtext [--gemtext.<option>=<value> ...] <file-or-directory> ...");
            log.info("Converts .html, .htm and .xhtml files to .gmi gemtext files.");
            return;
        }

        long startTime = System.currentTimeMillis();
        ConversionSummary summary = ConversionSummary.empty();
        for (Path input : inputs) {
            summary = summary.plus(conversionService.convert(input));
        }
        long duration = System.currentTimeMillis() - startTime;

        log.info("===============================================");
        log.info("Converted {} files in {} ms", summary.converted(), duration);
        if (summary.failed() > 0) {
            log.warn("Failed to convert {} files", summary.failed());
        }
        log.info("===============================================");
    }

    static List<Path> inputPaths(String... args) {
        if (args == null) {
            return List.of();
        }
        return Arrays.stream(args)
                .filter(arg -> arg != null && !arg.isBlank() && !arg.startsWith(OPTION_PREFIX))
                .map(Path::of)
                .toList();
    }
}
