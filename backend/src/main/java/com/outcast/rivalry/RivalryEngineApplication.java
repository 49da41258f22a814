package com.outcast.rivalry;

import com.outcast.rivalry.config.RivalryProperties;
import com.outcast.rivalry.config.SleeperApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({RivalryProperties.class, SleeperApiProperties.class})
public class RivalryEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(RivalryEngineApplication.class, args);
    }
}
