package com.phillippitts.agentcore.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Sub-agents exposed to the top-level loop as delegates, e.g.
 * <pre>
 * agent.sub-agents[0].name=voice
 * agent.sub-agents[0].description=Talks to the user out loud
 * agent.sub-agents[0].delegates=speak
 * agent.sub-agents[0].max-iterations=4
 * </pre>
 */
@ConfigurationProperties(prefix = "agent")
public class SubAgentProperties {

    private List<SubAgent> subAgents = new ArrayList<>();

    public List<SubAgent> getSubAgents() {
        return subAgents;
    }

    public void setSubAgents(List<SubAgent> subAgents) {
        this.subAgents = subAgents;
    }

    public static class SubAgent {
        private String name;
        private String description = "";
        /** Names of plain delegates this sub-agent may call. */
        private List<String> delegates = new ArrayList<>();
        private int maxIterations = 4;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<String> getDelegates() {
            return delegates;
        }

        public void setDelegates(List<String> delegates) {
            this.delegates = delegates;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }
    }
}
