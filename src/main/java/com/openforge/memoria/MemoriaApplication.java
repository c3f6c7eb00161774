package com.openforge.memoria;

import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.worker.RecoveryProperties;
import com.openforge.memoria.worker.WorkerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({WorkerProperties.class, RecoveryProperties.class, AgentProperties.class})
public class MemoriaApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoriaApplication.class, args);
    }
}
