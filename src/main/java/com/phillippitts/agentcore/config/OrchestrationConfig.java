package com.phillippitts.agentcore.config;

import com.phillippitts.agentcore.config.properties.AgentLoopProperties;
import com.phillippitts.agentcore.config.properties.AudioValidationProperties;
import com.phillippitts.agentcore.config.properties.PipelineProperties;
import com.phillippitts.agentcore.config.properties.QueueProperties;
import com.phillippitts.agentcore.config.properties.ReasoningHttpProperties;
import com.phillippitts.agentcore.config.properties.SubAgentProperties;
import com.phillippitts.agentcore.service.agent.HttpReasoningBackend;
import com.phillippitts.agentcore.service.agent.LoopBudget;
import com.phillippitts.agentcore.service.agent.PromptRenderer;
import com.phillippitts.agentcore.service.agent.ReasoningBackend;
import com.phillippitts.agentcore.service.agent.ReasoningLoop;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import com.phillippitts.agentcore.service.delegate.AgentDelegate;
import com.phillippitts.agentcore.service.delegate.Delegate;
import com.phillippitts.agentcore.service.delegate.DelegateInvoker;
import com.phillippitts.agentcore.service.delegate.DelegateTable;
import com.phillippitts.agentcore.service.delegate.SpeakDelegate;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.service.pipeline.DefaultSpeechPipeline;
import com.phillippitts.agentcore.service.pipeline.SpeechPipeline;
import com.phillippitts.agentcore.service.queue.DefaultOrchestrationQueue;
import com.phillippitts.agentcore.service.queue.OrchestrationQueue;
import com.phillippitts.agentcore.service.validation.AudioValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the reasoning loop, the delegate manifest, the orchestration queue and the speech
 * pipeline.
 *
 * <p>The delegate manifest is every {@link Delegate} bean plus one {@link AgentDelegate} per
 * configured sub-agent. Sub-agents may only call plain delegates, never other sub-agents.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    @Bean
    @ConditionalOnMissingBean(ReasoningBackend.class)
    public ReasoningBackend reasoningBackend(ReasoningHttpProperties props, Clock clock) {
        return new HttpReasoningBackend(props, new PromptRenderer(props.getInstructions(), clock));
    }

    @Bean
    public DelegateInvoker delegateInvoker(@Qualifier("delegateExecutor") Executor delegateExecutor,
                                           OrchestrationMetricsPublisher metrics) {
        return new DelegateInvoker(delegateExecutor, metrics);
    }

    @Bean
    public ReasoningLoop reasoningLoop(ReasoningBackend backend,
                                       DelegateInvoker invoker,
                                       @Qualifier("delegateExecutor") Executor delegateExecutor) {
        return new ReasoningLoop(backend, invoker, delegateExecutor);
    }

    @Bean
    public SpeakDelegate speakDelegate(SynthesisRegistry synthesisRegistry) {
        return new SpeakDelegate(synthesisRegistry);
    }

    @Bean
    public LoopBudget loopBudget(AgentLoopProperties props) {
        return LoopBudget.from(props);
    }

    @Bean
    public DelegateTable delegateTable(ObjectProvider<Delegate> delegateBeans,
                                       SubAgentProperties subAgents,
                                       ReasoningLoop loop,
                                       LoopBudget budget) {
        List<Delegate> plain = delegateBeans.orderedStream().toList();
        DelegateTable plainTable = DelegateTable.of(plain);
        List<Delegate> all = new ArrayList<>(plain);
        for (SubAgentProperties.SubAgent sub : subAgents.getSubAgents()) {
            List<Delegate> own = sub.getDelegates().stream().map(plainTable::require).toList();
            LoopBudget subBudget = new LoopBudget(sub.getMaxIterations(), budget.delegateTimeout(),
                    Duration.ZERO, budget.reasoningTimeout());
            all.add(new AgentDelegate(sub.getName(), sub.getDescription(), loop, DelegateTable.of(own), subBudget));
        }
        DelegateTable table = DelegateTable.of(all);
        LOG.info("Delegate manifest: {}", table.names());
        return table;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public OrchestrationQueue orchestrationQueue(ReasoningLoop loop,
                                                 DelegateTable delegateTable,
                                                 LoopBudget budget,
                                                 QueueProperties props,
                                                 @Qualifier("orchestrationExecutor") Executor orchestrationExecutor,
                                                 ApplicationEventPublisher publisher,
                                                 OrchestrationMetricsPublisher metrics) {
        return new DefaultOrchestrationQueue(loop, delegateTable, budget, props, orchestrationExecutor,
                publisher, metrics);
    }

    @Bean
    public AudioValidator audioValidator(AudioValidationProperties props) {
        return new AudioValidator(props);
    }

    @Bean
    public SpeechPipeline speechPipeline(AudioValidator validator,
                                         TranscriptionRegistry transcriptionRegistry,
                                         SynthesisRegistry synthesisRegistry,
                                         OrchestrationQueue queue,
                                         PipelineProperties props,
                                         @Qualifier("delegateExecutor") Executor stageExecutor,
                                         OrchestrationMetricsPublisher metrics) {
        return new DefaultSpeechPipeline(validator, transcriptionRegistry, synthesisRegistry, queue, props,
                stageExecutor, metrics);
    }
}
