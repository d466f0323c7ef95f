package com.phillippitts.agenthandoff;

import com.phillippitts.agenthandoff.config.properties.HandoffProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(HandoffProperties.class)
@EnableScheduling
public class AgentHandoffApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentHandoffApplication.class, args);
    }

}
