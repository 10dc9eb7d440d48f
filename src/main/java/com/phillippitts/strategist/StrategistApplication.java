package com.phillippitts.strategist;

import com.phillippitts.strategist.config.properties.AgentProperties;
import com.phillippitts.strategist.config.properties.LlmProperties;
import com.phillippitts.strategist.config.properties.RetrievalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AgentProperties.class,
        LlmProperties.class,
        RetrievalProperties.class
})
public class StrategistApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategistApplication.class, args);
    }

}
