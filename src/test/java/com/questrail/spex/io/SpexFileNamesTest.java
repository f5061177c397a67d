package com.questrail.spex.io;

import com.questrail.spex.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class SpexFileNamesTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void missingExtensionIsAppendedSilently()
    {
        assertEquals(Path.of("out", "source.spo"), SpexFileNames.spectrumFile(Path.of("out", "source"), sink));
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void wrongExtensionIsReplacedWithAWarning()
    {
        assertEquals(Path.of("source.res"), SpexFileNames.responseFile(Path.of("source.rsp"), sink));
        assertTrue(sink.hasWarningContaining("does not end with .res"));
    }

    @Test
    void matchingExtensionIsKept()
    {
        assertEquals(Path.of("a.SPO"), SpexFileNames.spectrumFile(Path.of("a.SPO"), sink));
        assertTrue(sink.getWarnings().isEmpty());
    }
}
