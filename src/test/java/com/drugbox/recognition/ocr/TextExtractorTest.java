package com.drugbox.recognition.ocr;

import com.drugbox.recognition.core.model.BoundingBox;
import com.drugbox.recognition.core.model.BoxAngle;
import com.drugbox.recognition.core.model.BoxCondition;
import com.drugbox.recognition.core.model.BoxLighting;
import com.drugbox.recognition.core.model.ExtractedText;
import com.drugbox.recognition.core.model.FailureKind;
import com.drugbox.recognition.core.model.Region;
import com.drugbox.recognition.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TextExtractorTest {

    private static final RetryConfig FAST_RETRY = new RetryConfig(3, Duration.ofMillis(1), 1.0);

    @Mock
    private TextRecognitionService service;

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private Region region;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        registry = new SimpleMeterRegistry();
        region = new Region("scan-r0", 0, new BoundingBox(0, 0, 120, 120),
                new BufferedImage(120, 120, BufferedImage.TYPE_INT_RGB), 0.9,
                BoxCondition.PERFECT, BoxAngle.FRONT, BoxLighting.NORMAL, false);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private TextExtractor extractor(RetryConfig retry, Duration timeout) {
        return new TextExtractor(service, retry, timeout, new TextQualityScorer(), executor,
                new MicrometerMetricsService(registry));
    }

    @Test
    @DisplayName("Should score recognized text and keep the service confidence")
    void success() {
        when(service.recognize(any())).thenReturn(new RecognizedText("PAROL 500 mg", 0.93));

        ExtractedText text = extractor(FAST_RETRY, Duration.ofSeconds(2)).extract(region);

        assertEquals("scan-r0", text.regionId());
        assertEquals("PAROL 500 mg", text.text());
        assertEquals(0.93, text.serviceConfidence());
        assertTrue(text.hasServiceConfidence());
        assertTrue(text.quality() > 0.8, "quality " + text.quality());
    }

    @Test
    @DisplayName("Should retry a transient failure")
    void retried() {
        when(service.recognize(any()))
                .thenThrow(new TextRecognitionException(TextRecognitionException.Kind.SERVICE_UNAVAILABLE, "busy"))
                .thenReturn(RecognizedText.of("Amoxil"));

        ExtractedText text = extractor(FAST_RETRY, Duration.ofSeconds(2)).extract(region);

        assertEquals("Amoxil", text.text());
        assertFalse(text.hasServiceConfidence());
        verify(service, times(2)).recognize(any());
        assertEquals(1.0, registry.get("drugbox.ocr.retry").counter().count());
    }

    @Test
    @DisplayName("Should not retry unreadable input")
    void invalidInput() {
        when(service.recognize(any()))
                .thenThrow(new TextRecognitionException(TextRecognitionException.Kind.INVALID_INPUT, "blank crop"));

        ExtractionFailureException e = assertThrows(ExtractionFailureException.class,
                () -> extractor(FAST_RETRY, Duration.ofSeconds(2)).extract(region));

        assertEquals(FailureKind.EXTRACTION, e.getKind());
        assertEquals(1, e.getAttempts());
        assertEquals("scan-r0", e.getRegionId());
        verify(service, times(1)).recognize(any());
    }

    @Test
    @DisplayName("Should bound retries")
    void exhausted() {
        when(service.recognize(any()))
                .thenThrow(new TextRecognitionException(TextRecognitionException.Kind.SERVICE_UNAVAILABLE, "down"));

        ExtractionFailureException e = assertThrows(ExtractionFailureException.class,
                () -> extractor(FAST_RETRY, Duration.ofSeconds(2)).extract(region));

        assertEquals(FailureKind.EXTRACTION, e.getKind());
        assertEquals(3, e.getAttempts());
        verify(service, times(3)).recognize(any());
    }

    @Test
    @DisplayName("Should time out a slow service")
    void timeout() {
        when(service.recognize(any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return RecognizedText.of("late");
        });

        ExtractionFailureException e = assertThrows(ExtractionFailureException.class,
                () -> extractor(RetryConfig.noRetry(), Duration.ofMillis(50)).extract(region));

        assertEquals(FailureKind.TIMEOUT, e.getKind());
    }

    @Test
    @DisplayName("Should count a missing result as unavailable")
    void nullResult() {
        when(service.recognize(any())).thenReturn(null);

        ExtractionFailureException e = assertThrows(ExtractionFailureException.class,
                () -> extractor(RetryConfig.noRetry(), Duration.ofSeconds(2)).extract(region));
        assertEquals(FailureKind.EXTRACTION, e.getKind());
    }

    @Nested
    @DisplayName("RetryConfig")
    class RetryConfigTests {

        @Test
        @DisplayName("Should grow backoff by the multiplier")
        void backoff() {
            RetryConfig config = RetryConfig.defaults();
            assertEquals(Duration.ZERO, config.backoffBefore(1));
            assertEquals(Duration.ofMillis(200), config.backoffBefore(2));
            assertEquals(Duration.ofMillis(400), config.backoffBefore(3));
        }

        @Test
        @DisplayName("Should reject invalid values")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new RetryConfig(0, Duration.ZERO, 1.0));
            assertThrows(IllegalArgumentException.class, () -> new RetryConfig(1, Duration.ofMillis(-1), 1.0));
            assertThrows(IllegalArgumentException.class, () -> new RetryConfig(1, Duration.ZERO, 0.5));
        }
    }

    @ParameterizedTest
    @DisplayName("Should separate readable text from noise by quality")
    @CsvSource({
            "'PAROL 500 mg', 0.8, 1.0",
            "'Glucophage 850 mg Film Tablet', 0.8, 1.0",
            "'x#q !!', 0.0, 0.3",
            "'', 0.0, 0.0"
    })
    void quality(String text, double min, double max) {
        double score = new TextQualityScorer().score(text);
        assertTrue(score >= min && score <= max, text + " scored " + score);
    }
}
