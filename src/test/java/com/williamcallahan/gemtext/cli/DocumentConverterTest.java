package com.williamcallahan.gemtext.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.gemtext.domain.ConversionSummary;
import com.williamcallahan.gemtext.service.GemtextConversionService;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies command line argument handling of {@link DocumentConverter}.
 */
class DocumentConverterTest {

    @Test
    void inputPaths_skipsPropertyOptionsAndBlanks() {
        List<Path> inputs = DocumentConverter.inputPaths("--gemtext.pretty-tables=true", "a.html", " ", "docs");

        assertEquals(List.of(Path.of("a.html"), Path.of("docs")), inputs);
    }

    @Test
    void inputPaths_handlesMissingArguments() {
        assertEquals(List.of(), DocumentConverter.inputPaths((String[]) null));
    }

    @Test
    void run_convertsEveryInput() {
        GemtextConversionService conversionService = mock(GemtextConversionService.class);
        when(conversionService.convert(any())).thenReturn(new ConversionSummary(1, 0));

        new DocumentConverter(conversionService).run("a.html", "--gemtext.omit-links=true", "b.html");

        verify(conversionService).convert(Path.of("a.html"));
        verify(conversionService).convert(Path.of("b.html"));
    }

    @Test
    void run_withoutInputsConvertsNothing() {
        GemtextConversionService conversionService = mock(GemtextConversionService.class);

        new DocumentConverter(conversionService).run("--spring.main.banner-mode=off");

        verify(conversionService, never()).convert(any());
    }
}
