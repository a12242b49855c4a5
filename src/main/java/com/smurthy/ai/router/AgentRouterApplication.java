package com.smurthy.ai.router;

import com.smurthy.ai.router.config.AgentPoolProperties;
import com.smurthy.ai.router.config.RouterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({RouterProperties.class, AgentPoolProperties.class})
public class AgentRouterApplication {

	public static void main(String[] args) {
		SpringApplication.run(AgentRouterApplication.class, args);
	}

}
