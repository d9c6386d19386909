package com.spintax.demo;

import com.spintax.engine.core.SpintaxSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class EditorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EditorConfiguration.class);

    @Bean
    SpintaxSession spintaxSession(
            @Value("${spintax.history-capacity:50}") int historyCapacity,
            @Value("${spintax.variation-ceiling:1000000}") long variationCeiling,
            @Value("${spintax.load-example:true}") boolean loadExample) {
        SpintaxSession.Config config = new SpintaxSession.Config();
        config.historyCapacity = historyCapacity;
        config.variationCeiling = variationCeiling;
        log.info(
                "Editing session: historyCapacity={}, variationCeiling={}, example={}",
                historyCapacity,
                variationCeiling,
                loadExample);
        return loadExample ? SpintaxSession.withExample(config) : new SpintaxSession(config);
    }
}
