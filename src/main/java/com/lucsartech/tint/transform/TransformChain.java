package com.lucsartech.tint.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of transforms applied to every image.
 * Thread-safe as long as its steps are pure, which is the contract of {@link ImageTransform}.
 */
public final class TransformChain implements ImageTransform {

    private static final Logger log = LoggerFactory.getLogger(TransformChain.class);

    private final List<Step> steps;

    public record Step(String name, ImageTransform transform) {
        public Step {
            Objects.requireNonNull(name, "Step name is required");
            Objects.requireNonNull(transform, "Step transform is required");
        }
    }

    public TransformChain(List<Step> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Transform chain needs at least one step");
        }
        this.steps = List.copyOf(steps);
    }

    /**
     * Grayscale followed by sepia.
     */
    public static TransformChain grayscaleSepia() {
        return new TransformChain(List.of(
                new Step("grayscale", ImageFilters::grayscale),
                new Step("sepia", ImageFilters::sepia)));
    }

    @Override
    public BufferedImage apply(BufferedImage source) throws TransformException {
        BufferedImage current = source;
        for (Step step : steps) {
            current = step.transform().apply(current);
            if (current == null) {
                throw new TransformException("Step '" + step.name() + "' produced no image");
            }
            log.trace("Applied {} ({}x{})", step.name(), current.getWidth(), current.getHeight());
        }
        return current;
    }

    public List<String> stepNames() {
        return steps.stream().map(Step::name).toList();
    }
}
