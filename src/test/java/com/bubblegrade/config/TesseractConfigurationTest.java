package com.bubblegrade.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TesseractConfigurationTest {

    @TempDir
    Path tempDir;

    @Test
    void usesConfiguredDirectoryHoldingLanguageData() throws IOException {
        Files.createFile(tempDir.resolve("spa.traineddata"));

        assertThat(TesseractConfiguration.resolveDataPath(tempDir.toString(), "spa"))
                .isEqualTo(tempDir.normalize().toString());
    }

    @Test
    void descendsIntoNestedTessdataDirectory() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("tessdata"));
        Files.createFile(nested.resolve("spa.traineddata"));

        assertThat(TesseractConfiguration.resolveDataPath(tempDir.toString(), "spa"))
                .isEqualTo(nested.normalize().toString());
    }

    @Test
    void returnsNullWhenNoCandidateHoldsTheLanguage() {
        assertThat(TesseractConfiguration.resolveDataPath(tempDir.toString(), "zzz_missing")).isNull();
    }
}
