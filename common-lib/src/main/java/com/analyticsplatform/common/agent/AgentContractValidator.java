package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.exception.AgentRegistrationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that an agent instance honours the {@link Agent} contract before the factory
 * accepts it.
 *
 * <ul>
 *   <li>instance id and type name match what the factory asked for</li>
 *   <li>a ceiling is declared and at least one capability exists</li>
 *   <li>every capability has a unique non-blank name and a required level ≤ ceiling</li>
 * </ul>
 */
public final class AgentContractValidator {

    private AgentContractValidator() {}

    public static void validate(Agent agent, String expectedType, String expectedInstanceId) {
        if (agent == null) {
            throw new AgentRegistrationException("Constructor for type '" + expectedType + "' returned null");
        }
        if (!expectedInstanceId.equals(agent.agentId())) {
            throw new AgentRegistrationException("Agent of type '" + expectedType + "' reports id '"
                + agent.agentId() + "', expected '" + expectedInstanceId + "'");
        }
        if (!expectedType.equals(agent.typeName())) {
            throw new AgentRegistrationException("Agent registered as '" + expectedType
                + "' reports type '" + agent.typeName() + "'");
        }
        if (agent.ceiling() == null) {
            throw new AgentRegistrationException("Agent type '" + expectedType + "' declares no ceiling");
        }

        List<AgentCapability> capabilities = agent.listCapabilities();
        if (capabilities == null || capabilities.isEmpty()) {
            throw new AgentRegistrationException("Agent type '" + expectedType + "' declares no capabilities");
        }

        Set<String> seen = new HashSet<>();
        for (AgentCapability capability : capabilities) {
            if (capability == null || capability.name() == null || capability.name().isBlank()) {
                throw new AgentRegistrationException("Agent type '" + expectedType + "' declares an unnamed capability");
            }
            if (!seen.add(capability.name())) {
                throw new AgentRegistrationException("Agent type '" + expectedType
                    + "' declares capability '" + capability.name() + "' twice");
            }
            if (capability.requiredPermission() == null
                    || !agent.ceiling().permits(capability.requiredPermission())) {
                throw new AgentRegistrationException("Capability '" + capability.name() + "' of type '"
                    + expectedType + "' requires " + capability.requiredPermission()
                    + " above ceiling " + agent.ceiling());
            }
        }
    }
}
