package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.exception.AgentException;
import com.analyticsplatform.common.exception.AnalyticsErrorCode;
import com.analyticsplatform.common.exception.AnalyticsException;
import com.analyticsplatform.common.permission.PermissionCheck;
import com.analyticsplatform.common.permission.PermissionGuard;
import com.analyticsplatform.common.permission.PermissionLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for agents whose actions form a closed enum.
 *
 * <p>{@link #execute} does, in order:
 * <ol>
 *   <li>parse the action string into {@code A} (unknown → CAPABILITY_NOT_FOUND)</li>
 *   <li>re-check the caller's granted level against the capability (fail closed)</li>
 *   <li>dispatch to {@link #perform}, translating {@link AnalyticsException} into an error
 *       result with its own code</li>
 * </ol>
 * {@link AgentException} and any other runtime exception from {@link #perform} become
 * AGENT_EXECUTION_ERROR results. {@code execute} never throws.
 *
 * @param <A> the agent's action enum
 */
public abstract class AbstractAgent<A extends Enum<A> & AgentAction> implements Agent {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String agentId;
    private final String typeName;
    private final PermissionLevel ceiling;
    private final Map<String, A> actionsByName;
    private final List<AgentCapability> capabilities;

    protected AbstractAgent(String agentId, String typeName, PermissionLevel ceiling, Class<A> actionType) {
        this.agentId  = Objects.requireNonNull(agentId, "agentId");
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.ceiling  = Objects.requireNonNull(ceiling, "ceiling");

        Map<String, A> byName = new LinkedHashMap<>();
        for (A action : actionType.getEnumConstants()) {
            byName.put(action.actionName(), action);
        }
        this.actionsByName = Collections.unmodifiableMap(byName);
        this.capabilities = Arrays.stream(actionType.getEnumConstants())
            .map(AgentAction::capability)
            .toList();
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public PermissionLevel ceiling() {
        return ceiling;
    }

    @Override
    public List<AgentCapability> listCapabilities() {
        return capabilities;
    }

    public Optional<A> resolveAction(String action) {
        return action == null ? Optional.empty() : Optional.ofNullable(actionsByName.get(action));
    }

    @Override
    public final ActionResult execute(String action, Map<String, Object> parameters, CallerContext callerContext) {
        Optional<A> resolved = resolveAction(action);
        if (resolved.isEmpty()) {
            return ActionResult.error(AnalyticsErrorCode.CAPABILITY_NOT_FOUND,
                "[" + agentId + "] Unknown action '" + action + "'");
        }

        PermissionLevel callerLevel = callerContext != null ? callerContext.grantedLevel() : null;
        PermissionCheck check = PermissionGuard.check(capabilities, action, callerLevel);
        if (!check.isGranted()) {
            return ActionResult.error(check.errorCode(), "[" + agentId + "] " + check.message());
        }

        Map<String, Object> safeParameters = parameters != null ? parameters : Map.of();
        try {
            return perform(resolved.get(), safeParameters, callerContext);
        } catch (AnalyticsException e) {
            log.warn("[{}] action={} code={} message={}", agentId, action, e.getCode(), e.getMessage());
            return ActionResult.error(e.getCode(), e.getMessage());
        } catch (AgentException e) {
            log.error("[{}] action={} failed", agentId, action, e);
            return ActionResult.error(e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] action={} failed unexpectedly", agentId, action, e);
            AgentException wrapped = new AgentException(agentId, action,
                e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            return ActionResult.error(wrapped.getCode(), wrapped.getMessage());
        }
    }

    /** Performs an already parsed and permission-checked action. */
    protected abstract ActionResult perform(A action, Map<String, Object> parameters, CallerContext callerContext);
}
