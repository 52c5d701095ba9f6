package com.sandkev.redditclient.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@link Instrumentation} on a Micrometer registry. Sampled counters are scaled back up
 * by {@code 1 / sampleRate} so totals stay comparable.
 */
@Slf4j
public class MicrometerInstrumentation implements Instrumentation {

    private final MeterRegistry registry;
    private final DoubleSupplier sampler;

    public MicrometerInstrumentation(MeterRegistry registry) {
        this(registry, () -> ThreadLocalRandom.current().nextDouble());
    }

    MicrometerInstrumentation(MeterRegistry registry, DoubleSupplier sampler) {
        this.registry = registry;
        this.sampler = sampler;
    }

    @Override
    public void increment(String name, List<String> tags, double sampleRate) {
        try {
            double rate = effectiveRate(sampleRate);
            if (!sampled(rate)) return;
            registry.counter(name, toTags(tags)).increment(1.0 / rate);
        } catch (RuntimeException e) {
            log.debug("dropping counter {}: {}", name, e.toString());
        }
    }

    @Override
    public void record(String name, double value, List<String> tags, double sampleRate) {
        try {
            if (!sampled(effectiveRate(sampleRate))) return;
            DistributionSummary.builder(name)
                    .tags(toTags(tags))
                    .register(registry)
                    .record(value);
        } catch (RuntimeException e) {
            log.debug("dropping histogram {}: {}", name, e.toString());
        }
    }

    private boolean sampled(double rate) {
        return rate >= 1.0 || sampler.getAsDouble() < rate;
    }

    private static double effectiveRate(double sampleRate) {
        return sampleRate <= 0.0 || sampleRate > 1.0 ? 1.0 : sampleRate;
    }

    static Tags toTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) return Tags.empty();
        Tags out = Tags.empty();
        for (String t : tags) {
            int i = t.indexOf(':');
            out = i > 0
                    ? out.and(Tag.of(t.substring(0, i), t.substring(i + 1)))
                    : out.and(Tag.of(t, "true"));
        }
        return out;
    }
}
