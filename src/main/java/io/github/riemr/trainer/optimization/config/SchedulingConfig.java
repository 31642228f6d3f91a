package io.github.riemr.trainer.optimization.config;

import io.github.riemr.trainer.optimization.ranking.PriorityWeights;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PriorityWeights.class)
public class SchedulingConfig {
}
