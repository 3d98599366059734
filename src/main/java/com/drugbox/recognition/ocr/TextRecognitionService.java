package com.drugbox.recognition.ocr;

import java.awt.image.BufferedImage;

/**
 * External OCR capability. Implementations may be remote, slow, or fail transiently;
 * they signal failure with {@link TextRecognitionException}.
 */
@FunctionalInterface
public interface TextRecognitionService {

    RecognizedText recognize(BufferedImage crop);
}
