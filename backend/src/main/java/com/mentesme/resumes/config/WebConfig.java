package com.mentesme.resumes.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AppProperties appProperties;

    public WebConfig(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = appProperties.getAllowedOrigins();
        CorsRegistration registration = registry.addMapping("/**")
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("*");
        if (origins.contains("*")) {
            // any origin, so no credentials
            registration.allowedOrigins("*").allowCredentials(false);
        } else {
            registration.allowedOrigins(origins.toArray(String[]::new)).allowCredentials(true);
        }
    }
}
