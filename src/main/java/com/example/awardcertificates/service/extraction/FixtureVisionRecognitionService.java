package com.example.awardcertificates.service.extraction;

import com.example.awardcertificates.model.CanonicalImage;

/**
 * Replays a configured reply instead of calling the network. Used for local
 * development and deterministic tests.
 */
public class FixtureVisionRecognitionService implements VisionRecognitionService {

    private final String reply;

    public FixtureVisionRecognitionService(String reply) {
        this.reply = reply == null ? "" : reply;
    }

    @Override
    public String recognize(CanonicalImage image, String prompt) {
        return reply;
    }

    @Override
    public String modelName() {
        return "fixture";
    }
}
