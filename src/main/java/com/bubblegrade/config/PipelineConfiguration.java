package com.bubblegrade.config;

import com.bubblegrade.config.GradingProperties.PipelineProperties;
import com.bubblegrade.repository.InMemoryScanRepository;
import com.bubblegrade.repository.ScanRepository;
import com.bubblegrade.service.notification.LoggingScanEventPublisher;
import com.bubblegrade.service.notification.ScanEventPublisher;
import com.bubblegrade.util.MdcAwareExecutor;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfiguration {

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor scanExecutor(GradingProperties properties) {
        PipelineProperties pipeline = properties.pipeline();
        return MdcAwareExecutor.rejectingWhenFull("scan", pipeline.scanThreads(), pipeline.queueCapacity());
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor gradingExecutor(GradingProperties properties) {
        PipelineProperties pipeline = properties.pipeline();
        // every grading task must run: the scan closes the image once they are joined
        return MdcAwareExecutor.callerRunsWhenFull("grading", pipeline.gradingThreads(), pipeline.queueCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanRepository scanRepository() {
        return new InMemoryScanRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanEventPublisher scanEventPublisher() {
        return new LoggingScanEventPublisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
