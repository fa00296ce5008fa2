package com.bloomcart.scoring;

import com.bloomcart.scoring.config.AppProperties;
import com.bloomcart.scoring.config.GradingProperties;
import com.bloomcart.scoring.config.ProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProperties.class, ProviderProperties.class, GradingProperties.class})
public class ScoringApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScoringApplication.class, args);
    }
}
