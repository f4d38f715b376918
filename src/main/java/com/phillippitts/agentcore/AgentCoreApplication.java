package com.phillippitts.agentcore;

import com.phillippitts.agentcore.config.properties.AgentLoopProperties;
import com.phillippitts.agentcore.config.properties.AudioValidationProperties;
import com.phillippitts.agentcore.config.properties.BackendProperties;
import com.phillippitts.agentcore.config.properties.PipelineProperties;
import com.phillippitts.agentcore.config.properties.PiperProperties;
import com.phillippitts.agentcore.config.properties.QueueProperties;
import com.phillippitts.agentcore.config.properties.ReasoningHttpProperties;
import com.phillippitts.agentcore.config.properties.SubAgentProperties;
import com.phillippitts.agentcore.config.properties.ThreadPoolProperties;
import com.phillippitts.agentcore.config.properties.WhisperCppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AgentLoopProperties.class,
        QueueProperties.class,
        SubAgentProperties.class,
        BackendProperties.class,
        WhisperCppProperties.class,
        PiperProperties.class,
        ReasoningHttpProperties.class,
        PipelineProperties.class,
        AudioValidationProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class AgentCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentCoreApplication.class, args);
    }

}
