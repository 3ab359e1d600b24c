package com.phillippitts.screentranslate.testutil;

import com.phillippitts.screentranslate.exception.AnalysisException;
import com.phillippitts.screentranslate.service.vision.VisionProvider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for a vision endpoint that returns a canned reply.
 */
public class FakeVisionProvider implements VisionProvider {

    public volatile String cannedReply;
    public volatile boolean configured = true;
    private volatile AnalysisException failure;
    private final AtomicInteger calls = new AtomicInteger();

    public FakeVisionProvider(String cannedReply) {
        this.cannedReply = cannedReply;
    }

    public static FakeVisionProvider withSegments(String... texts) {
        StringBuilder json = new StringBuilder("{\"segments\":[");
        for (int i = 0; i < texts.length; i++) {
            double top = 0.1 + i * 0.2;
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"text\":\"").append(texts[i]).append("\",\"bbox\":[0.1,")
                    .append(top).append(",0.6,").append(top + 0.1).append("],\"confidence\":0.9}");
        }
        return new FakeVisionProvider(json.append("]}").toString());
    }

    public FakeVisionProvider failingWith(AnalysisException e) {
        this.failure = e;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String id() {
        return "fake-vision";
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public String extractText(String base64Jpeg, String systemPrompt, String userPrompt) {
        calls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        return cannedReply;
    }
}
