package com.governance.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.core.repository.ExecutionRecordRepository;
import com.governance.core.repository.RunRepository;
import com.governance.core.repository.StepRunRepository;
import com.governance.engine.draft.PatchApplier;
import com.governance.engine.execution.ExecutionEngine;
import com.governance.engine.execution.PlaybookLoader;
import com.governance.engine.execution.PlaybookRegistry;
import com.governance.engine.execution.Sleeper;
import com.governance.engine.execution.StepActionRegistry;
import com.governance.engine.metrics.GovernanceMetrics;
import com.governance.engine.persistence.InMemoryExecutionRecordRepository;
import com.governance.engine.persistence.InMemoryRunRepository;
import com.governance.engine.persistence.InMemoryStepRunRepository;
import com.governance.engine.persistence.jdbc.JdbcExecutionRecordRepository;
import com.governance.engine.persistence.jdbc.JdbcRunRepository;
import com.governance.engine.persistence.jdbc.JdbcStepRunRepository;
import com.governance.engine.policy.PolicyCatalog;
import com.governance.engine.policy.PolicyCatalogLoader;
import com.governance.engine.policy.PolicyEvaluator;
import com.governance.engine.policy.PolicyGate;
import com.governance.engine.statemachine.StateMachineSpec;
import com.governance.engine.statemachine.StateMachineSpecLoader;
import com.governance.engine.statemachine.TransitionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the control plane. Specifications are loaded once at startup; a malformed file fails the
 * context rather than leaving a half-configured process.
 */
@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class GovernanceEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StateMachineSpec stateMachineSpec(GovernanceProperties properties, ResourceLoader resourceLoader,
                                             GovernanceMetrics metrics) {
        StateMachineSpec spec = new StateMachineSpecLoader(resourceLoader).load(properties.getStateMachineLocation());
        metrics.specificationLoaded("state-machine");
        return spec;
    }

    @Bean
    public TransitionGuard transitionGuard(StateMachineSpec spec) {
        return new TransitionGuard(spec);
    }

    @Bean
    public PolicyCatalog policyCatalog(GovernanceProperties properties, ResourceLoader resourceLoader,
                                       GovernanceMetrics metrics) {
        PolicyCatalog catalog = new PolicyCatalogLoader(resourceLoader).load(properties.getPoliciesLocation());
        metrics.specificationLoaded("policies");
        return catalog;
    }

    @Bean
    public PolicyEvaluator policyEvaluator(PolicyCatalog catalog, ExecutionRecordRepository records,
                                           Clock clock, GovernanceMetrics metrics) {
        return new PolicyEvaluator(catalog, records, clock, metrics);
    }

    @Bean
    public PolicyGate policyGate(PolicyEvaluator evaluator, ExecutionRecordRepository records,
                                 Clock clock, GovernanceMetrics metrics) {
        return new PolicyGate(evaluator, records, clock, metrics);
    }

    @Bean
    public PlaybookRegistry playbookRegistry(GovernanceProperties properties, ResourceLoader resourceLoader,
                                             GovernanceMetrics metrics) {
        GovernanceProperties.Execution execution = properties.getExecution();
        PlaybookLoader loader = new PlaybookLoader(new PathMatchingResourcePatternResolver(resourceLoader),
            execution.getDefaultTimeout(), execution.getMaxBackoff());
        PlaybookRegistry registry = loader.load(properties.getPlaybooksLocation());
        metrics.specificationLoaded("playbooks");
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public StepActionRegistry stepActionRegistry() {
        return StepActionRegistry.withBuiltins();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public ExecutionEngine executionEngine(RunRepository runs, StepRunRepository steps, PlaybookRegistry playbooks,
                                           StepActionRegistry actions, TransitionGuard guard, PolicyGate gate,
                                           Clock clock, Sleeper sleeper, GovernanceMetrics metrics,
                                           ObjectProvider<ObjectMapper> objectMapper) {
        return new ExecutionEngine(runs, steps, playbooks, actions, guard, gate, clock, sleeper, metrics,
            objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    public PatchApplier patchApplier() {
        return new PatchApplier();
    }

    /**
     * Default storage; state is lost on restart.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "governance.persistence", name = "mode", havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryPersistence {

        @Bean
        public ExecutionRecordRepository executionRecordRepository() {
            log.warn("Using in-memory persistence; audit trail and runs are not durable");
            return new InMemoryExecutionRecordRepository();
        }

        @Bean
        public RunRepository runRepository() {
            return new InMemoryRunRepository();
        }

        @Bean
        public StepRunRepository stepRunRepository() {
            return new InMemoryStepRunRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "governance.persistence", name = "mode", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public ExecutionRecordRepository executionRecordRepository(JdbcTemplate jdbcTemplate,
                                                                   ObjectProvider<ObjectMapper> objectMapper) {
            return new JdbcExecutionRecordRepository(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        public RunRepository runRepository(JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new JdbcRunRepository(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        public StepRunRepository stepRunRepository(JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new JdbcStepRunRepository(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }
    }
}
