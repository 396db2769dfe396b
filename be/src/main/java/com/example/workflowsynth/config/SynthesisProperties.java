package com.example.workflowsynth.config;

import com.example.workflowsynth.validation.ValidationThresholds;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code synthesis.*} settings: fragment generation pool and validator thresholds.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "synthesis")
public class SynthesisProperties {

    private Generation generation = new Generation();
    private Validation validation = new Validation();

    @Getter
    @Setter
    public static class Generation {
        private int maxConcurrency = 4;
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Getter
    @Setter
    public static class Validation {
        private int highCostThreshold = 5;
        private int credentialReuseThreshold = 3;
        private int largeGraphThreshold = 20;
        private int branchingThreshold = 3;

        public ValidationThresholds toThresholds() {
            return new ValidationThresholds(highCostThreshold, credentialReuseThreshold, largeGraphThreshold,
                    branchingThreshold);
        }
    }
}
