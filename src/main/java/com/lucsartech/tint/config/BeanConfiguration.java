package com.lucsartech.tint.config;

import com.lucsartech.tint.imaging.ImageCodec;
import com.lucsartech.tint.imaging.ImageDiscovery;
import com.lucsartech.tint.pipeline.ImagePipeline;
import com.lucsartech.tint.pipeline.SequentialRunner;
import com.lucsartech.tint.transform.TransformChain;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Bean configuration for Tint components.
 */
@Configuration
public class BeanConfiguration {

    @Bean
    public ImageDiscovery imageDiscovery(TintProperties properties) {
        return new ImageDiscovery(properties.getExtensions(), properties.isCreateInputDirectory());
    }

    @Bean
    public ImageCodec imageCodec(TintProperties properties) {
        return new ImageCodec(properties.getPipeline().getJpegQuality());
    }

    @Bean
    public TransformChain transformChain() {
        return TransformChain.grayscaleSepia();
    }

    @Bean
    public SequentialRunner sequentialRunner(TintProperties properties, ImageCodec codec, TransformChain chain) {
        return new SequentialRunner(properties.sequentialConfig(), codec, chain);
    }

    @Bean
    public ImagePipeline imagePipeline(TintProperties properties, ImageCodec codec, TransformChain chain) {
        return new ImagePipeline(properties.parallelConfig(), codec, chain);
    }
}
