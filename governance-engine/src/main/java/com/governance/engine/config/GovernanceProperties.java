package com.governance.engine.config;

import com.governance.core.model.run.PlaybookDefinition;
import com.governance.engine.execution.PlaybookLoader;
import com.governance.engine.policy.PolicyCatalogLoader;
import com.governance.engine.statemachine.StateMachineSpecLoader;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code governance} prefix.
 */
@ConfigurationProperties(prefix = "governance")
public class GovernanceProperties {

    /** Directory holding state-machine.yaml, transitions.yaml and external-mapping.yaml. */
    private String stateMachineLocation = StateMachineSpecLoader.DEFAULT_LOCATION;

    private String policiesLocation = PolicyCatalogLoader.DEFAULT_LOCATION;

    /** Resource pattern matching playbook YAML files. */
    private String playbooksLocation = PlaybookLoader.DEFAULT_LOCATION;

    private final Persistence persistence = new Persistence();

    private final Execution execution = new Execution();

    public String getStateMachineLocation() {
        return stateMachineLocation;
    }

    public void setStateMachineLocation(String stateMachineLocation) {
        this.stateMachineLocation = stateMachineLocation;
    }

    public String getPoliciesLocation() {
        return policiesLocation;
    }

    public void setPoliciesLocation(String policiesLocation) {
        this.policiesLocation = policiesLocation;
    }

    public String getPlaybooksLocation() {
        return playbooksLocation;
    }

    public void setPlaybooksLocation(String playbooksLocation) {
        this.playbooksLocation = playbooksLocation;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public Execution getExecution() {
        return execution;
    }

    public static class Persistence {

        /** {@code in-memory} or {@code jdbc}. */
        private String mode = "in-memory";

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }
    }

    public static class Execution {

        /** Run timeout for playbooks that do not declare one. */
        private Duration defaultTimeout = PlaybookDefinition.DEFAULT_TIMEOUT;

        /** Upper bound on the wait between step attempts. */
        private Duration maxBackoff = Duration.ofSeconds(60);

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }
}
