package com.bubblegrade.config;

import com.bubblegrade.config.GradingProperties.OcrProperties;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the in-process Tesseract engine used by the local grading backend. Language data is
 * looked up in the configured path, then {@code TESSDATA_PREFIX}, then common install locations.
 */
@Configuration
@ConditionalOnProperty(prefix = "bubblegrade.backend", name = "mode", havingValue = "local", matchIfMissing = true)
public class TesseractConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseractConfiguration.class);

    @Bean
    public ITesseract tesseract(GradingProperties properties) {
        OcrProperties ocr = properties.ocr();
        String language = ocr.language();
        String resolvedDataPath = resolveDataPath(ocr.datapath(), language);
        if (resolvedDataPath == null) {
            String message = String.format(Locale.ROOT,
                    "Unable to locate Tesseract language data for '%s'. "
                            + "Provide it via the bubblegrade.ocr.datapath property or the TESSDATA_PREFIX environment variable.",
                    language);
            log.error(message);
            throw new IllegalStateException(message);
        }
        log.info("Configuring Tesseract data path: {}", resolvedDataPath);
        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(resolvedDataPath);
        tesseract.setLanguage(language);
        tesseract.setOcrEngineMode(ocr.engineMode());
        tesseract.setPageSegMode(ocr.pageSegMode());
        return tesseract;
    }

    static String resolveDataPath(String configured, String language) {
        List<String> candidates = new ArrayList<>();
        if (configured != null && !configured.isBlank()) {
            candidates.add(configured.trim());
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }
        candidates.add("/usr/share/tesseract-ocr/5/tessdata");
        candidates.add("/usr/share/tesseract-ocr/4.00/tessdata");
        candidates.add("/usr/local/share/tessdata");

        for (String candidate : candidates) {
            Path validPath = validateCandidate(candidate, language);
            if (validPath != null) {
                return validPath.toString();
            }
        }
        return null;
    }

    private static Path validateCandidate(String candidate, String language) {
        Path basePath;
        try {
            basePath = Paths.get(candidate).normalize();
        } catch (InvalidPathException ex) {
            log.warn("Tesseract data path candidate '{}' is invalid: {}", candidate, ex.getMessage());
            return null;
        }
        if (!Files.isDirectory(basePath)) {
            return null;
        }
        if (Files.isRegularFile(basePath.resolve(language + ".traineddata"))) {
            return basePath;
        }
        Path tessdataDirectory = basePath.resolve("tessdata");
        if (Files.isRegularFile(tessdataDirectory.resolve(language + ".traineddata"))) {
            return tessdataDirectory;
        }
        log.debug("Tesseract data path candidate '{}' does not contain {}.traineddata", candidate, language);
        return null;
    }
}
