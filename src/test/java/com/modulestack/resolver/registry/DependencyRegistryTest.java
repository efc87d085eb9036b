package com.modulestack.resolver.registry;

import com.modulestack.resolver.model.DependencyNode;
import com.modulestack.resolver.model.ModuleIdentity;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DependencyRegistry.
 */
class DependencyRegistryTest {

    private static final ModuleIdentity ASYN_439 = identity("asyn", "R4.39");
    private static final ModuleIdentity ASYN_442 = identity("asyn", "R4.42");

    private final DependencyRegistry registry = new DependencyRegistry();

    @Test
    void testRegisterNewVariable() {
        assertThat(registry.register("ASYN", ASYN_439)).isTrue();

        assertThat(registry.isRegistered("ASYN")).isTrue();
        assertThat(registry.identity("ASYN")).contains(ASYN_439);
        assertThat(registry.node("ASYN")).isEmpty();
    }

    @Test
    void testRegisteringSameIdentityTwiceIsNoOp() {
        registry.register("ASYN", ASYN_439);
        Map<String, ModuleIdentity> before = Map.copyOf(registry.getIdentities());

        boolean added = registry.register("ASYN", identity("asyn", "R4.39"));

        assertThat(added).isFalse();
        assertThat(registry.getIdentities()).isEqualTo(before);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void testRegisteringDifferentIdentityIsRejected() {
        registry.register("ASYN", ASYN_439);

        RegistrationConflictException conflict = catchThrowableOfType(
                () -> registry.register("ASYN", ASYN_442), RegistrationConflictException.class);

        assertThat(conflict).isNotNull();
        assertThat(conflict.getVariableName()).isEqualTo("ASYN");
        assertThat(conflict.getRegistered()).isEqualTo(ASYN_439);
        assertThat(conflict.getRejected()).isEqualTo(ASYN_442);
        assertThat(registry.identity("ASYN")).contains(ASYN_439);
    }

    @Test
    void testVariablesKeepRegistrationOrder() {
        registry.register("SSCAN", identity("sscan", "R2.11"));
        registry.register("ASYN", ASYN_439);
        registry.register("CALC", identity("calc", "R3.7"));

        assertThat(registry.getVariables()).containsExactly("SSCAN", "ASYN", "CALC");
    }

    @Test
    void testAttachNode() {
        registry.register("ASYN", ASYN_439);
        DependencyNode node = new DependencyNode("ASYN", Map.of(), Map.of(), List.of());

        registry.attachNode("ASYN", node);
        registry.attachNode("ASYN", node);

        assertThat(registry.node("ASYN")).containsSame(node);
        assertThat(registry.getNodes()).containsOnlyKeys("ASYN");
    }

    @Test
    void testAttachNodeToUnregisteredVariableFails() {
        DependencyNode node = new DependencyNode("ASYN", Map.of(), Map.of(), List.of());

        assertThatThrownBy(() -> registry.attachNode("ASYN", node))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testAttachingSecondNodeFails() {
        registry.register("ASYN", ASYN_439);
        registry.attachNode("ASYN", new DependencyNode("ASYN", Map.of(), Map.of(), List.of()));

        assertThatThrownBy(() -> registry.attachNode("ASYN", new DependencyNode("ASYN", Map.of(), Map.of(), List.of())))
                .isInstanceOf(IllegalStateException.class);
    }

    private static ModuleIdentity identity(String name, String tag) {
        return ModuleIdentity.builder().base("R7.0.2-2.0").name(name).tag(tag).build();
    }
}
