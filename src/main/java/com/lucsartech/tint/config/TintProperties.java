package com.lucsartech.tint.config;

import com.lucsartech.tint.pipeline.PipelineConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Tint.
 * Mapped from application.yml under the "tint" prefix.
 */
@ConfigurationProperties(prefix = "tint")
@Validated
public class TintProperties {

    @NotNull
    private RunMode mode = RunMode.BOTH;

    @NotBlank
    private String inputDirectory = "input_images";

    private boolean createInputDirectory = true;

    @NotEmpty
    private List<String> extensions = new ArrayList<>(List.of("jpg"));

    private boolean verifyParity = true;

    @Valid
    private final Pipeline pipeline = new Pipeline();
    @Valid
    private final Output output = new Output();
    @Valid
    private final Report report = new Report();

    // Getters and setters
    public RunMode getMode() { return mode; }
    public void setMode(RunMode mode) { this.mode = mode; }

    public String getInputDirectory() { return inputDirectory; }
    public void setInputDirectory(String inputDirectory) { this.inputDirectory = inputDirectory; }

    public boolean isCreateInputDirectory() { return createInputDirectory; }
    public void setCreateInputDirectory(boolean createInputDirectory) { this.createInputDirectory = createInputDirectory; }

    public List<String> getExtensions() { return extensions; }
    public void setExtensions(List<String> extensions) { this.extensions = extensions; }

    public boolean isVerifyParity() { return verifyParity; }
    public void setVerifyParity(boolean verifyParity) { this.verifyParity = verifyParity; }

    public Pipeline getPipeline() { return pipeline; }
    public Output getOutput() { return output; }
    public Report getReport() { return report; }

    /**
     * Run settings for the sequential baseline.
     */
    public PipelineConfig sequentialConfig() {
        return new PipelineConfig(1, Path.of(inputDirectory),
                Path.of(output.getSequentialDirectory()), pipeline.getJpegQuality());
    }

    /**
     * Run settings for the parallel pipeline.
     */
    public PipelineConfig parallelConfig() {
        return new PipelineConfig(pipeline.effectiveWorkerThreads(), Path.of(inputDirectory),
                Path.of(output.getParallelDirectory()), pipeline.getJpegQuality());
    }

    /**
     * Pipeline processing configuration.
     */
    public static class Pipeline {
        @Min(0)
        private int workerThreads = 0; // 0 = available processors

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private float jpegQuality = PipelineConfig.DEFAULT_JPEG_QUALITY;

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public float getJpegQuality() { return jpegQuality; }
        public void setJpegQuality(float jpegQuality) { this.jpegQuality = jpegQuality; }

        public int effectiveWorkerThreads() {
            return workerThreads > 0 ? workerThreads : PipelineConfig.defaultWorkerCount();
        }
    }

    /**
     * Output locations, one per runner.
     */
    public static class Output {
        @NotBlank
        private String sequentialDirectory = "output_sequential";
        @NotBlank
        private String parallelDirectory = "output_parallel";

        public String getSequentialDirectory() { return sequentialDirectory; }
        public void setSequentialDirectory(String sequentialDirectory) { this.sequentialDirectory = sequentialDirectory; }

        public String getParallelDirectory() { return parallelDirectory; }
        public void setParallelDirectory(String parallelDirectory) { this.parallelDirectory = parallelDirectory; }
    }

    /**
     * Report generation configuration.
     */
    public static class Report {
        private String directory = "reports";
        private boolean enabled = false;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
