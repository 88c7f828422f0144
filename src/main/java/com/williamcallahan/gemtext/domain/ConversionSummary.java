package com.williamcallahan.gemtext.domain;

/**
 * Counts of a batch conversion.
 *
 * @param converted files written successfully
 * @param failed files that could not be read, rendered or written
 */
public record ConversionSummary(int converted, int failed) {

    public static ConversionSummary empty() {
        return new ConversionSummary(0, 0);
    }

    public ConversionSummary plus(ConversionSummary other) {
        return new ConversionSummary(converted + other.converted, failed + other.failed);
    }

    public ConversionSummary withConverted() {
        return new ConversionSummary(converted + 1, failed);
    }

    public ConversionSummary withFailed() {
        return new ConversionSummary(converted, failed + 1);
    }
}
