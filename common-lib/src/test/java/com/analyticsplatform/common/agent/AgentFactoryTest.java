package com.analyticsplatform.common.agent;

import com.analyticsplatform.common.exception.AgentRegistrationException;
import com.analyticsplatform.common.permission.PermissionLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AgentFactoryTest {

    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    private AgentFactory factory;

    @BeforeEach
    void setUp() {
        factory = new AgentFactory(FIXED);
    }

    // ── register() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("register()")
    class RegisterTests {

        @Test
        @DisplayName("conforming type is registered")
        void conformingType() {
            factory.register(SampleAgent.TYPE, SampleAgent::new);
            assertEquals(List.of(SampleAgent.TYPE), List.copyOf(factory.registeredTypes()));
            assertTrue(factory.listAgents().isEmpty(), "probe instance must not be kept");
        }

        @Test
        @DisplayName("same constructor twice is a no-op")
        void sameConstructor_idempotent() {
            AgentConstructor constructor = SampleAgent::new;
            factory.register(SampleAgent.TYPE, constructor);
            assertDoesNotThrow(() -> factory.register(SampleAgent.TYPE, constructor));
            assertEquals(1, factory.registeredTypes().size());
        }

        @Test
        @DisplayName("different constructor for an existing type → AgentRegistrationException")
        void differentConstructor_rejected() {
            factory.register(SampleAgent.TYPE, SampleAgent::new);
            AgentConstructor other = id -> new SampleAgent(id);
            assertThrows(AgentRegistrationException.class, () -> factory.register(SampleAgent.TYPE, other));
        }

        @Test
        @DisplayName("capability above the ceiling → rejected at registration")
        void capabilityAboveCeiling_rejected() {
            AgentConstructor lowCeiling = id -> new StubAgent(id, "low", PermissionLevel.READ_EXECUTE,
                List.of(cap("predict", PermissionLevel.READ_EXECUTE), cap("purge", PermissionLevel.ADMIN)));
            assertThrows(AgentRegistrationException.class, () -> factory.register("low", lowCeiling));
            assertTrue(factory.registeredTypes().isEmpty());
        }

        @Test
        @DisplayName("no capabilities → rejected")
        void noCapabilities_rejected() {
            assertThrows(AgentRegistrationException.class,
                () -> factory.register("empty", id -> new StubAgent(id, "empty", PermissionLevel.ADMIN, List.of())));
        }

        @Test
        @DisplayName("duplicate capability names → rejected")
        void duplicateCapabilityNames_rejected() {
            assertThrows(AgentRegistrationException.class,
                () -> factory.register("dup", id -> new StubAgent(id, "dup", PermissionLevel.ADMIN,
                    List.of(cap("predict", PermissionLevel.READ_ONLY), cap("predict", PermissionLevel.READ_EXECUTE)))));
        }

        @Test
        @DisplayName("agent reporting another type name → rejected")
        void typeNameMismatch_rejected() {
            assertThrows(AgentRegistrationException.class,
                () -> factory.register("alias", SampleAgent::new));
        }

        @Test
        @DisplayName("throwing constructor → AgentRegistrationException with cause")
        void throwingConstructor() {
            AgentRegistrationException e = assertThrows(AgentRegistrationException.class,
                () -> factory.register("broken", id -> { throw new IllegalStateException("no model pack"); }));
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("random registrations: every accepted capability sits at or below its agent's ceiling")
        void randomRegistrations_respectCeiling() {
            Random random = new Random(42);
            PermissionLevel[] levels = PermissionLevel.values();
            for (int i = 0; i < 200; i++) {
                String type = "type_" + i;
                PermissionLevel ceiling = levels[random.nextInt(levels.length)];
                PermissionLevel required = levels[random.nextInt(levels.length)];
                AgentConstructor constructor = id -> new StubAgent(id, type, ceiling, List.of(cap("op", required)));
                try {
                    factory.register(type, constructor);
                    factory.create(type, type);
                } catch (AgentRegistrationException e) {
                    assertTrue(required.rank() > ceiling.rank(), "rejected a conforming agent: " + e.getMessage());
                }
            }
            for (Agent agent : factory.agents()) {
                for (AgentCapability capability : agent.listCapabilities()) {
                    assertTrue(agent.ceiling().permits(capability.requiredPermission()),
                        agent.agentId() + "." + capability.name());
                }
            }
        }
    }

    // ── create() / get() / destroy() ───────────────────────────────────────

    @Nested
    @DisplayName("instances")
    class InstanceTests {

        @BeforeEach
        void register() {
            factory.register(SampleAgent.TYPE, SampleAgent::new);
        }

        @Test
        @DisplayName("create then get returns the same instance")
        void createThenGet() {
            Agent agent = factory.create(SampleAgent.TYPE, "sample-1");
            assertSame(agent, factory.get("sample-1").orElseThrow());
            assertEquals("sample-1", agent.agentId());
        }

        @Test
        @DisplayName("create without id derives <type>_<epochMillis>")
        void derivedId() {
            Agent agent = factory.create(SampleAgent.TYPE);
            assertEquals("sample_1700000000000", agent.agentId());
        }

        @Test
        @DisplayName("duplicate instance id → AgentRegistrationException")
        void duplicateInstance() {
            factory.create(SampleAgent.TYPE, "sample-1");
            assertThrows(AgentRegistrationException.class, () -> factory.create(SampleAgent.TYPE, "sample-1"));
        }

        @Test
        @DisplayName("unknown type → AgentRegistrationException")
        void unknownType() {
            assertThrows(AgentRegistrationException.class, () -> factory.create("nope", "nope-1"));
        }

        @Test
        @DisplayName("get of an unknown id is empty")
        void getUnknown() {
            assertTrue(factory.get("missing").isEmpty());
            assertTrue(factory.get(null).isEmpty());
        }

        @Test
        @DisplayName("listAgents is ordered by id and describes capabilities")
        void listAgents() {
            factory.create(SampleAgent.TYPE, "b");
            factory.create(SampleAgent.TYPE, "a");
            List<AgentDescriptor> agents = factory.listAgents();
            assertEquals(List.of("a", "b"), agents.stream().map(AgentDescriptor::agentId).toList());
        }

        @Test
        @DisplayName("destroy removes the instance")
        void destroy() {
            factory.create(SampleAgent.TYPE, "sample-1");
            assertTrue(factory.destroy("sample-1"));
            assertFalse(factory.destroy("sample-1"));
            assertTrue(factory.get("sample-1").isEmpty());
        }
    }

    // ── fixtures ───────────────────────────────────────────────────────────

    private static AgentCapability cap(String name, PermissionLevel level) {
        return AgentCapability.of(name, name, level, List.of(), List.of(), 0.1);
    }

    private record StubAgent(String agentId, String typeName, PermissionLevel ceiling,
                             List<AgentCapability> listCapabilities) implements Agent {
        @Override
        public ActionResult execute(String action, Map<String, Object> parameters, CallerContext callerContext) {
            return ActionResult.success(Map.of());
        }
    }
}
