package com.nutrilog.backend.config;

import com.nutrilog.backend.common.web.MdcTaskDecorator;
import com.nutrilog.backend.prediction.session.PredictionSessionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PredictionSessionProperties.class)
public class PredictionConfig {

    /** Tests replace this with a fixed clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("predictionFetchExecutor")
    public TaskExecutor predictionFetchExecutor(PredictionSessionProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getFetchPoolSize());
        ex.setMaxPoolSize(props.getFetchPoolSize());
        ex.setQueueCapacity(props.getFetchQueueCapacity());
        ex.setThreadNamePrefix("prediction-fetch-");
        // fetch and scoring logs keep the caller's rid
        ex.setTaskDecorator(new MdcTaskDecorator());
        ex.initialize();
        return ex;
    }
}
