package world.willfrog.backtestmicro.backtestservice.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BacktestProperties.class)
public class BacktestServiceConfig {
}
