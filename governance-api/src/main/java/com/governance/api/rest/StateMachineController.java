package com.governance.api.rest;

import com.governance.core.model.statemachine.Evidence;
import com.governance.core.model.statemachine.ExternalSource;
import com.governance.core.model.statemachine.ExternalStatusMapping;
import com.governance.core.model.statemachine.StateDefinition;
import com.governance.engine.statemachine.StateMachineSpec;
import com.governance.engine.statemachine.TransitionGuard;
import com.governance.engine.statemachine.TransitionVerdict;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the lifecycle state machine and transition checks.
 */
@RestController
@RequestMapping("/api/v1/state-machine")
public class StateMachineController {

    private final TransitionGuard transitionGuard;

    public StateMachineController(TransitionGuard transitionGuard) {
        this.transitionGuard = transitionGuard;
    }

    @GetMapping("/states")
    public ResponseEntity<List<StateResponse>> states() {
        StateMachineSpec spec = transitionGuard.spec();
        return ResponseEntity.ok(spec.states().stream().map(state -> StateResponse.from(spec, state)).toList());
    }

    @GetMapping("/states/{name}")
    public ResponseEntity<StateResponse> state(@PathVariable String name) {
        StateMachineSpec spec = transitionGuard.spec();
        return ResponseEntity.ok(StateResponse.from(spec, spec.getState(name)));
    }

    @GetMapping("/states/{name}/next")
    public ResponseEntity<NextStatesResponse> nextStates(@PathVariable String name) {
        StateMachineSpec spec = transitionGuard.spec();
        List<String> next = spec.getValidNextStates(name).stream().map(StateDefinition::name).toList();
        return ResponseEntity.ok(new NextStatesResponse(name, spec.isTerminalState(name), next));
    }

    /**
     * Checks a transition against the state graph and the supplied evidence. With a trigger the
     * transition must also be automatic on that trigger.
     */
    @PostMapping("/transitions/check")
    public ResponseEntity<TransitionCheckResponse> check(@RequestBody TransitionCheckRequest request) {
        Evidence evidence = request.evidence() == null ? Evidence.none() : Evidence.of(request.evidence());
        TransitionVerdict verdict = request.trigger() == null
            ? transitionGuard.evaluate(request.from(), request.to(), evidence)
            : transitionGuard.evaluateAutomatic(request.from(), request.to(), request.trigger(), evidence);
        return ResponseEntity.ok(new TransitionCheckResponse(
            verdict.allowed(),
            verdict.code().name(),
            verdict.message(),
            verdict.transition() != null ? verdict.transition().name() : null,
            verdict.missingPreconditions()
        ));
    }

    @GetMapping("/external/{source}/{status}")
    public ResponseEntity<ExternalMappingResponse> mapExternal(@PathVariable String source, @PathVariable String status) {
        ExternalSource externalSource = ExternalSource.fromTag(source);
        Optional<StateDefinition> state = transitionGuard.spec().mapExternalStatusToState(status, externalSource);
        return ResponseEntity.ok(new ExternalMappingResponse(
            externalSource.name(), status, state.map(StateDefinition::name).orElse(null)));
    }

    // ========== DTOs ==========

    public record StateResponse(
        String name,
        String description,
        String category,
        boolean terminal,
        List<String> successors,
        List<String> labels,
        List<String> requiredChecks,
        List<String> optionalChecks
    ) {
        static StateResponse from(StateMachineSpec spec, StateDefinition state) {
            ExternalStatusMapping.CheckRequirements checks = spec.getRequiredChecks(state.name());
            return new StateResponse(
                state.name(),
                state.description(),
                state.category().name(),
                state.terminal(),
                state.successors(),
                spec.getExternalLabelsForState(state.name()),
                checks.required(),
                checks.optional()
            );
        }
    }

    public record NextStatesResponse(String state, boolean terminal, List<String> nextStates) {}

    public record TransitionCheckRequest(
        String from,
        String to,
        Map<String, Boolean> evidence,
        String trigger
    ) {}

    public record TransitionCheckResponse(
        boolean allowed,
        String code,
        String message,
        String transition,
        List<String> missingPreconditions
    ) {}

    /**
     * @param state null when the status maps to nothing or an incidental terminal signal was ignored
     */
    public record ExternalMappingResponse(String source, String status, String state) {}
}
