package com.workspacepilot.orchestrator.dependency;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DependencyResolver.
 *
 * Pure in-memory graphs; no backend involved.
 */
class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    // network <- database <- app, network <- cache <- app, monitoring standalone
    private static final WorkspaceNode[] DIAMOND = {
            WorkspaceNode.of("app", "database", "cache"),
            WorkspaceNode.of("database", "network"),
            WorkspaceNode.of("cache", "network"),
            WorkspaceNode.of("network"),
            WorkspaceNode.of("monitoring")
    };

    // ------------------------------------------------------------------
    // Unordered actions
    // ------------------------------------------------------------------

    @Test
    void create_returnsDeclarationOrder() {
        ExecutionPlan plan = resolver.resolveExecutionOrder(WorkspaceConfiguration.of(ActionType.CREATE, DIAMOND));

        assertThat(plan.order()).containsExactly("app", "database", "cache", "network", "monitoring");
    }

    @Test
    void delete_ignoresCycles() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.DELETE,
                WorkspaceNode.of("a", "b"), WorkspaceNode.of("b", "a"));

        assertThatCode(() -> resolver.validate(config)).doesNotThrowAnyException();
        assertThat(resolver.resolveExecutionOrder(config).order()).containsExactly("a", "b");
    }

    // ------------------------------------------------------------------
    // Apply / destroy ordering
    // ------------------------------------------------------------------

    @Test
    void apply_everyWorkspaceComesAfterItsDependencies() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.APPLY, DIAMOND);

        List<String> order = resolver.resolveExecutionOrder(config).order();

        assertThat(order).containsExactlyInAnyOrder("app", "database", "cache", "network", "monitoring");
        for (WorkspaceNode node : config.nodes()) {
            for (String dep : node.dependsOn()) {
                assertThat(order.indexOf(node.name()))
                        .as("%s must come after %s", node.name(), dep)
                        .isGreaterThan(order.indexOf(dep));
            }
        }
    }

    @Test
    void apply_isDeterministicForAFixedDeclarationOrder() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.APPLY, DIAMOND);

        assertThat(resolver.resolveExecutionOrder(config).order())
                .containsExactly("network", "database", "cache", "app", "monitoring");
    }

    @Test
    void destroy_isExactReverseOfApply() {
        List<String> apply   = resolver.resolveExecutionOrder(WorkspaceConfiguration.of(ActionType.APPLY, DIAMOND)).order();
        List<String> destroy = resolver.resolveExecutionOrder(WorkspaceConfiguration.of(ActionType.DESTROY, DIAMOND)).order();

        List<String> reversed = new ArrayList<>(apply);
        java.util.Collections.reverse(reversed);
        assertThat(destroy).isEqualTo(reversed);
    }

    @Test
    void apply_longChainDeclaredBackwards_isSortedForwards() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.APPLY,
                WorkspaceNode.of("d", "c"),
                WorkspaceNode.of("c", "b"),
                WorkspaceNode.of("b", "a"),
                WorkspaceNode.of("a"));

        assertThat(resolver.resolveExecutionOrder(config).order()).containsExactly("a", "b", "c", "d");
    }

    // ------------------------------------------------------------------
    // Cycles
    // ------------------------------------------------------------------

    @Test
    void apply_cycle_reportsClosedPath() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.APPLY,
                WorkspaceNode.of("a", "b"),
                WorkspaceNode.of("b", "c"),
                WorkspaceNode.of("c", "a"));

        assertThatThrownBy(() -> resolver.resolveExecutionOrder(config))
                .isInstanceOf(DependencyCycleException.class)
                .hasMessageContaining("a -> b -> c -> a")
                .satisfies(e -> assertThat(((DependencyCycleException) e).getCycle())
                        .containsExactly("a", "b", "c", "a"));
    }

    @Test
    void apply_cycleBelowEntryPoint_pathStartsAtRepeatedWorkspace() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.APPLY,
                WorkspaceNode.of("root", "x"),
                WorkspaceNode.of("x", "y"),
                WorkspaceNode.of("y", "x"));

        assertThatThrownBy(() -> resolver.resolveExecutionOrder(config))
                .isInstanceOf(DependencyCycleException.class)
                .satisfies(e -> {
                    List<String> cycle = ((DependencyCycleException) e).getCycle();
                    assertThat(cycle).containsExactly("x", "y", "x");
                    assertThat(cycle.get(0)).isEqualTo(cycle.get(cycle.size() - 1));
                });
    }

    @Test
    void destroy_validate_detectsCycle() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.DESTROY,
                WorkspaceNode.of("a", "b"), WorkspaceNode.of("b", "a"));

        assertThatThrownBy(() -> resolver.validate(config))
                .isInstanceOf(DependencyCycleException.class);
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    @ParameterizedTest
    @EnumSource(ActionType.class)
    void validate_unknownDependency_failsForEveryAction(ActionType action) {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(action,
                WorkspaceNode.of("app", "network"));

        assertThatThrownBy(() -> resolver.validate(config))
                .isInstanceOf(UnknownDependencyException.class)
                .hasMessageContaining("'app' depends on 'network'")
                .satisfies(e -> {
                    UnknownDependencyException u = (UnknownDependencyException) e;
                    assertThat(u.getWorkspace()).isEqualTo("app");
                    assertThat(u.getDependency()).isEqualTo("network");
                });
    }

    @ParameterizedTest
    @EnumSource(ActionType.class)
    void validate_selfDependency_failsForEveryAction(ActionType action) {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(action,
                WorkspaceNode.of("network"),
                WorkspaceNode.of("app", "network", "app"));

        assertThatThrownBy(() -> resolver.validate(config))
                .isInstanceOf(SelfDependencyException.class)
                .hasMessage("Workspace 'app' cannot depend on itself");
    }

    @Test
    void validate_acyclicApply_passes() {
        assertThatCode(() -> resolver.validate(WorkspaceConfiguration.of(ActionType.APPLY, DIAMOND)))
                .doesNotThrowAnyException();
    }

    @Test
    void resolve_unknownDependencyDuringTraversal_namesBothWorkspaces() {
        WorkspaceConfiguration config = WorkspaceConfiguration.of(ActionType.APPLY,
                WorkspaceNode.of("app", "ghost"));

        assertThatThrownBy(() -> resolver.resolveExecutionOrder(config))
                .isInstanceOf(UnknownDependencyException.class)
                .hasMessageContaining("app")
                .hasMessageContaining("ghost");
    }
}
