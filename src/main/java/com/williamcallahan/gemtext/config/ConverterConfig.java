package com.williamcallahan.gemtext.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * File conversion settings for the command line converter.
 */
public class ConverterConfig {

    private static final String OUTPUT_EXT_DEF = "gmi";
    private static final List<String> INPUT_EXT_DEF = List.of("html", "htm", "xhtml");
    private static final String OUTPUT_DIR_KEY = "gemtext.cli.output-dir";
    private static final String OUTPUT_EXT_KEY = "gemtext.cli.extension";
    private static final String INPUT_EXT_KEY = "gemtext.cli.input-extensions";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String BLANK_TEXT_FMT = "%s must not be blank.";
    private static final String EMPTY_LIST_FMT = "%s must name at least one extension.";

    private String outputDir = "";
    private String extension = OUTPUT_EXT_DEF;
    private List<String> inputExtensions = new ArrayList<>(INPUT_EXT_DEF);

    /**
     * Creates converter configuration.
     */
    public ConverterConfig() {
    }

    /**
     * Validates converter settings.
     */
    public void validateConfiguration() {
        requireNonNullText(OUTPUT_DIR_KEY, outputDir);
        requireNonNullText(OUTPUT_EXT_KEY, extension);
        if (extension.isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, OUTPUT_EXT_KEY));
        }
        if (inputExtensions.isEmpty()) {
            throw new IllegalStateException(String.format(Locale.ROOT, EMPTY_LIST_FMT, INPUT_EXT_KEY));
        }
        for (String inputExtension : inputExtensions) {
            if (inputExtension == null || inputExtension.isBlank()) {
                throw new IllegalStateException(String.format(Locale.ROOT, BLANK_TEXT_FMT, INPUT_EXT_KEY));
            }
        }
    }

    /**
     * Returns the directory converted files are written to; blank writes beside each input.
     *
     * @return output directory path, possibly blank
     */
    public String getOutputDir() {
        return outputDir;
    }

    /**
     * Sets the directory converted files are written to.
     *
     * @param outputDir output directory path; blank writes beside each input
     */
    public void setOutputDir(final String outputDir) {
        this.outputDir = requireNonNullText(OUTPUT_DIR_KEY, outputDir);
    }

    /**
     * Returns the file extension of converted files, without the dot.
     *
     * @return output extension
     */
    public String getExtension() {
        return extension;
    }

    /**
     * Sets the file extension of converted files. A leading dot is dropped.
     *
     * @param extension output extension
     */
    public void setExtension(final String extension) {
        String text = requireNonNullText(OUTPUT_EXT_KEY, extension).strip();
        this.extension = text.startsWith(".") ? text.substring(1) : text;
    }

    public List<String> getInputExtensions() {
        return inputExtensions;
    }

    public void setInputExtensions(final List<String> inputExtensions) {
        this.inputExtensions = inputExtensions == null ? new ArrayList<>() : new ArrayList<>(inputExtensions);
    }

    private static String requireNonNullText(final String propertyKey, final String text) {
        if (text == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, propertyKey));
        }
        return text;
    }
}
