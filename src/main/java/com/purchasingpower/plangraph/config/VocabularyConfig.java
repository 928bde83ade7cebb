package com.purchasingpower.plangraph.config;

import com.purchasingpower.plangraph.configuration.TransducerProperties;
import com.purchasingpower.plangraph.service.analysis.FrameworkVocabulary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the validated {@link TransducerProperties} as an immutable
 * {@link FrameworkVocabulary} shared by the analyzer and the synthesizer.
 *
 * @since 1.0.0
 */
@Configuration
public class VocabularyConfig {

    @Bean
    public FrameworkVocabulary frameworkVocabulary(TransducerProperties properties) {
        return new FrameworkVocabulary(properties);
    }
}
