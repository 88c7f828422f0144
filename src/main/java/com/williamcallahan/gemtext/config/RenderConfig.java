package com.williamcallahan.gemtext.config;

import com.williamcallahan.gemtext.domain.render.RenderOptions;
import com.williamcallahan.gemtext.service.gemtext.GemtextRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the validated render options and the renderer built from them.
 */
@Configuration
public class RenderConfig {

    private static final Logger log = LoggerFactory.getLogger(RenderConfig.class);

    @Bean
    public RenderOptions renderOptions(GemtextProperties properties) {
        properties.validateConfiguration();
        RenderOptions options = properties.toRenderOptions();
        log.debug("Render options: prettyTables={}, omitLinks={}, linkEmitFrequency={}",
                options.prettyTables(), options.omitLinks(), options.linkEmitFrequency());
        return options;
    }

    @Bean
    public GemtextRenderer gemtextRenderer(RenderOptions renderOptions) {
        return new GemtextRenderer(renderOptions);
    }
}
