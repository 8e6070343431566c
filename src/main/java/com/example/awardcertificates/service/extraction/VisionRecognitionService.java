package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.model.CanonicalImage;

/**
 * External vision capability that reads a certificate image. Implementations
 * return the model's textual reply untouched; interpreting it is the job of
 * {@link ExtractionResponseParser}.
 */
public interface VisionRecognitionService {

    /**
     * @param image  canonical certificate image
     * @param prompt instructions describing the expected field schema
     * @return the reply content produced by the recognition model
     * @throws RecognitionCallException when the call fails
     */
    String recognize(CanonicalImage image, String prompt);

    /**
     * @return identifier recorded as the extraction method on certificates
     */
    String modelName();
}
