package edu.uw.easyqg.annotation;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import java.util.Properties;

/**
 * Process-wide annotator, created on first use and shared read-only by every caller afterwards.
 * If creation fails, the next call tries again.
 */
public final class SharedAnnotator implements Annotator {
    private final Supplier<Annotator> delegate;

    public SharedAnnotator(final Supplier<? extends Annotator> factory) {
        this.delegate = Suppliers.memoize(() -> {
            try {
                return factory.get();
            } catch (RuntimeException e) {
                throw new IllegalStateException("Could not initialize the annotator", e);
            }
        });
    }

    public static SharedAnnotator coreNlp(final Properties properties) {
        final Properties copy = new Properties();
        copy.putAll(properties);
        return new SharedAnnotator(() -> new CoreNlpAnnotator(copy));
    }

    @Override
    public TokenStream annotate(final String text) {
        return delegate.get().annotate(text);
    }
}
