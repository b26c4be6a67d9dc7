package com.taskfactory.api.config;

import com.taskfactory.core.model.Phase;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets request parameters use phase wire names, e.g. {@code ?phase=ready}.
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, Phase.class, Phase::fromWireName);
    }
}
