package com.bubblegrade.service.backend;

import com.bubblegrade.exception.BackendUnavailableException;
import com.bubblegrade.exception.ExtractionException;
import com.bubblegrade.model.AnswerKey;
import com.bubblegrade.model.FieldResult;
import com.bubblegrade.model.OmrResult;
import com.bubblegrade.model.RegionBoundingBox;
import com.bubblegrade.model.RegionName;
import com.bubblegrade.service.ocr.FieldNormalizer;
import com.bubblegrade.util.ImageUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Delegates grading to the standalone OMR and OCR services over HTTP. Any transport failure,
 * timeout or non-success answer surfaces as {@link BackendUnavailableException}.
 */
public class RemoteGradingBackend implements GradingBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteGradingBackend.class);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient omrClient;
    private final WebClient ocrClient;
    private final Duration timeout;
    private final FieldNormalizer normalizer;
    private final ObjectMapper objectMapper;

    public RemoteGradingBackend(WebClient omrClient, WebClient ocrClient, Duration timeout,
            FieldNormalizer normalizer, ObjectMapper objectMapper) {
        this.omrClient = omrClient;
        this.ocrClient = ocrClient;
        this.timeout = timeout;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
    }

    /**
     * The OMR service locates the grid itself, so the whole enhanced sheet is uploaded.
     */
    @Override
    public OmrResult gradeOmr(Mat enhanced, RegionBoundingBox region, AnswerKey answerKey) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", ImageUtils.encode(enhanced, ".jpg"))
                .filename("sheet.jpg")
                .contentType(MediaType.IMAGE_JPEG);
        Map<String, Object> response = post(omrClient, "/grade", body, "OMR");
        return toOmrResult(response, answerKey);
    }

    @Override
    public FieldResult extractField(Mat enhanced, RegionBoundingBox region, RegionName field) {
        byte[] image;
        try (Mat crop = ImageUtils.crop(enhanced, region)) {
            image = ImageUtils.encode(crop, ".jpg");
        }
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("image", image)
                .filename(field.key() + ".jpg")
                .contentType(MediaType.IMAGE_JPEG);
        body.part("request", requestJson(field, region));
        Map<String, Object> response = post(ocrClient, "/ocr", body, "OCR");
        Object text = response.get("text");
        return normalizer.normalize(field, text == null ? "" : text.toString(), number(response.get("confidence")));
    }

    private Map<String, Object> post(WebClient client, String path, MultipartBodyBuilder body, String service) {
        try {
            Map<String, Object> response = client.post()
                    .uri(path)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .retrieve()
                    .bodyToMono(JSON_MAP)
                    .timeout(timeout)
                    .block();
            if (response == null) {
                throw new BackendUnavailableException(service + " service returned an empty body", null);
            }
            return response;
        } catch (BackendUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("{} service call to {} failed: {}", service, path, ex.getMessage());
            throw new BackendUnavailableException(service + " service unavailable: " + ex.getMessage(), ex);
        }
    }

    String requestJson(RegionName field, RegionBoundingBox region) {
        boolean nombre = field == RegionName.NOMBRE;
        OcrRequest request = new OcrRequest(field.key(), region,
                new Preprocessing(true, field == RegionName.CURP, nombre ? 1.2 : 1.0, nombre ? 0.1 : 0.0));
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException ex) {
            throw new ExtractionException("Unable to serialize OCR request", ex);
        }
    }

    /**
     * The OMR service reports either per-question booleans or the marked choice letters. Letters
     * are compared against the answer key locally; booleans are taken as reported.
     */
    OmrResult toOmrResult(Map<String, Object> response, AnswerKey answerKey) {
        List<?> rawAnswers = response.get("answers") instanceof List<?> list ? list : List.of();
        boolean letters = !rawAnswers.isEmpty() && rawAnswers.stream().allMatch(String.class::isInstance);
        if (answerKey != null && letters) {
            List<String> choices = new ArrayList<>();
            List<Boolean> answers = new ArrayList<>();
            int score = 0;
            for (int question = 0; question < answerKey.size(); question++) {
                String choice = question < rawAnswers.size() ? rawAnswers.get(question).toString().trim() : "";
                boolean correct = answerKey.isCorrect(question, choice);
                score += correct ? 1 : 0;
                choices.add(choice);
                answers.add(correct);
            }
            return new OmrResult(score, answers, answerKey.size(), choices);
        }
        if (answerKey != null) {
            log.warn("OMR service did not report choice letters; using its own scoring");
        }
        List<Boolean> answers = rawAnswers.stream()
                .map(value -> value instanceof Boolean flag ? flag : !value.toString().isBlank())
                .toList();
        List<String> choices = letters ? rawAnswers.stream().map(Object::toString).toList() : List.of();
        int score = (int) number(response.get("score"));
        Object total = response.get("total");
        return new OmrResult(score, answers, total == null ? answers.size() : (int) number(total), choices);
    }

    private static double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException ex) {
                log.debug("Ignoring non-numeric value '{}'", value);
            }
        }
        return 0.0;
    }

    record OcrRequest(String region, RegionBoundingBox boundingBox, Preprocessing preprocessing) {
    }

    record Preprocessing(boolean denoise, boolean sharpen, double contrast, double brightness) {
    }
}
