package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.exception.AgentRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of agent types and sole owner of agent instances.
 *
 * <h3>Registration</h3>
 * {@link #register} builds a probe instance and runs {@link AgentContractValidator} on it,
 * so a non-conforming type is rejected at wiring time rather than on its first call.
 * Registering the same constructor object twice is a no-op; a different constructor for
 * an existing type name is an {@link AgentRegistrationException}.
 *
 * <h3>Instances</h3>
 * {@link #create} validates the new instance again and rejects duplicate instance ids.
 * Instances live until {@link #destroy} or process shutdown.
 */
public class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    static final String PROBE_PREFIX = "probe:";

    private final Map<String, AgentConstructor> constructors = new ConcurrentHashMap<>();
    private final Map<String, Agent> instances = new ConcurrentHashMap<>();
    private final Clock clock;

    public AgentFactory() {
        this(Clock.systemUTC());
    }

    public AgentFactory(Clock clock) {
        this.clock = clock;
    }

    public void register(String typeName, AgentConstructor constructor) {
        requireName(typeName, "typeName");
        Objects.requireNonNull(constructor, "constructor");

        AgentConstructor existing = constructors.get(typeName);
        if (existing != null) {
            ensureSameConstructor(typeName, existing, constructor);
            log.debug("[AgentFactory] type={} already registered with the same constructor", typeName);
            return;
        }

        Agent probe = construct(typeName, constructor, PROBE_PREFIX + typeName);
        AgentContractValidator.validate(probe, typeName, PROBE_PREFIX + typeName);

        AgentConstructor raced = constructors.putIfAbsent(typeName, constructor);
        if (raced != null) {
            ensureSameConstructor(typeName, raced, constructor);
            return;
        }
        log.info("[AgentFactory] Registered type={} ceiling={} capabilities={}",
                 typeName, probe.ceiling(), probe.listCapabilities().size());
    }

    public Agent create(String typeName, String instanceId) {
        requireName(typeName, "typeName");
        requireName(instanceId, "instanceId");

        AgentConstructor constructor = constructors.get(typeName);
        if (constructor == null) {
            throw new AgentRegistrationException("Unknown agent type '" + typeName + "'");
        }
        if (instances.containsKey(instanceId)) {
            throw new AgentRegistrationException("Agent instance '" + instanceId + "' already exists");
        }

        Agent agent = construct(typeName, constructor, instanceId);
        AgentContractValidator.validate(agent, typeName, instanceId);

        if (instances.putIfAbsent(instanceId, agent) != null) {
            throw new AgentRegistrationException("Agent instance '" + instanceId + "' already exists");
        }
        log.info("[AgentFactory] Created agent={} type={}", instanceId, typeName);
        return agent;
    }

    /** Creates an instance with a derived id {@code <typeName>_<epochMillis>}. */
    public Agent create(String typeName) {
        return create(typeName, typeName + "_" + clock.millis());
    }

    public Optional<Agent> get(String instanceId) {
        return instanceId == null ? Optional.empty() : Optional.ofNullable(instances.get(instanceId));
    }

    public List<AgentDescriptor> listAgents() {
        return instances.values().stream()
            .sorted(Comparator.comparing(Agent::agentId))
            .map(AgentDescriptor::of)
            .toList();
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(constructors.keySet());
    }

    public Collection<Agent> agents() {
        return List.copyOf(instances.values());
    }

    public boolean destroy(String instanceId) {
        Agent removed = instanceId == null ? null : instances.remove(instanceId);
        if (removed != null) {
            log.info("[AgentFactory] Destroyed agent={}", instanceId);
        }
        return removed != null;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Agent construct(String typeName, AgentConstructor constructor, String instanceId) {
        try {
            return constructor.create(instanceId);
        } catch (RuntimeException e) {
            throw new AgentRegistrationException("Constructor for type '" + typeName + "' failed", e);
        }
    }

    private static void ensureSameConstructor(String typeName, AgentConstructor existing, AgentConstructor candidate) {
        if (!existing.equals(candidate)) {
            throw new AgentRegistrationException("Type '" + typeName + "' is already registered with a different constructor");
        }
    }

    private static void requireName(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
