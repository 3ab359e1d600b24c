package com.phillippitts.screentranslate.testutil;

import com.phillippitts.screentranslate.domain.TranslationResult;
import com.phillippitts.screentranslate.exception.TranslationProviderException;
import com.phillippitts.screentranslate.service.translation.AbstractTranslationProvider;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Test double for a translation backend.
 *
 * <p>Translates to {@code "<to>:<text>"} by default. Can be told to fail with a given
 * exception, or to block inside the batch call until {@link #release()} so tests can act
 * while a flow is in the translating phase.
 */
public class FakeTranslationProvider extends AbstractTranslationProvider {

    public volatile boolean available = true;
    private volatile TranslationProviderException failure;
    private volatile Function<String, String> translator;
    private volatile CountDownLatch gate;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicInteger batchCalls = new AtomicInteger();
    private final AtomicInteger singleCalls = new AtomicInteger();

    public FakeTranslationProvider(String id) {
        super(id, "Fake " + id);
    }

    public FakeTranslationProvider translatingWith(Function<String, String> fn) {
        this.translator = fn;
        return this;
    }

    public FakeTranslationProvider failingWith(TranslationProviderException e) {
        this.failure = e;
        return this;
    }

    /**
     * Makes the next batch call block until {@link #release()}.
     */
    public FakeTranslationProvider blocking() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch g = gate;
        if (g != null) {
            g.countDown();
        }
    }

    public boolean awaitEntered(long timeoutMs) throws InterruptedException {
        return entered.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public int batchCalls() {
        return batchCalls.get();
    }

    public int singleCalls() {
        return singleCalls.get();
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    protected TranslationResult doTranslate(String text, String from, String to) {
        singleCalls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        return new TranslationResult(text, translate(text, to), from, to);
    }

    @Override
    protected List<TranslationResult> doTranslateBatch(List<String> texts, String from, String to)
            throws InterruptedException {
        batchCalls.incrementAndGet();
        entered.countDown();
        CountDownLatch g = gate;
        if (g != null && !g.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("Fake provider was never released");
        }
        if (failure != null) {
            throw failure;
        }
        return texts.stream()
                .map(t -> new TranslationResult(t, translate(t, to), from, to))
                .toList();
    }

    private String translate(String text, String to) {
        Function<String, String> fn = translator;
        return fn != null ? fn.apply(text) : to + ":" + text;
    }
}
