package com.mentesme.resumes;

import com.mentesme.resumes.config.AppProperties;
import com.mentesme.resumes.service.storage.ResumeStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.servlet.support.SpringBootServletInitializer;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class ResumeCollectorApplication extends SpringBootServletInitializer {

    private static final Logger log = LoggerFactory.getLogger(ResumeCollectorApplication.class);

    @Override
    protected SpringApplicationBuilder configure(SpringApplicationBuilder application) {
        return application.sources(ResumeCollectorApplication.class);
    }

    @Bean
    ApplicationRunner startupSummary(AppProperties appProperties, ResumeStorage resumeStorage) {
        return args -> log.info("{} v{} started, resumes stored at {}",
                appProperties.getName(), appProperties.getVersion(), resumeStorage.describe(""));
    }

    public static void main(String[] args) {
        SpringApplication.run(ResumeCollectorApplication.class, args);
    }
}
