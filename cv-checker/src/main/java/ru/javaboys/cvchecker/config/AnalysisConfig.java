package ru.javaboys.cvchecker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import ru.javaboys.cvchecker.service.impl.SkillNormalizer;

import java.time.Clock;

@Configuration
public class AnalysisConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SkillNormalizer skillNormalizer(CvCheckerProperties properties) {
        return new SkillNormalizer(properties.getSkills().getAliases());
    }

    /**
     * LLM calls block, so streamed analyses run off the subscriber's thread.
     */
    @Bean
    public Scheduler analysisScheduler() {
        return Schedulers.boundedElastic();
    }
}
