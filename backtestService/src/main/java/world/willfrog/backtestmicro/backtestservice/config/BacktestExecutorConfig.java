package world.willfrog.backtestmicro.backtestservice.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class BacktestExecutorConfig {

    // 每个任务独占自己的 PortfolioState，线程间只共享不可变的价格快照
    @Bean(destroyMethod = "shutdown")
    public ExecutorService backtestExecutor(@Value("${backtest.executor.max-concurrency:4}") int maxConcurrency) {
        return Executors.newFixedThreadPool(Math.max(1, maxConcurrency));
    }
}
