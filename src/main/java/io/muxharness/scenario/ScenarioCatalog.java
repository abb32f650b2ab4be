package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class ScenarioCatalog {
    private ScenarioCatalog() {
    }

    /** The full suite in execution order. */
    public static List<Scenario> defaults() {
        return List.of(
                new SessionLifecycleScenario(),
                new WindowScenario(),
                new PaneScenario(),
                new ResizeScenario(),
                new SendKeysScenario(),
                new KillScenario(),
                new LayoutScenario(),
                new SwapRotateScenario(),
                new BufferScenario(),
                new ConcurrentSessionsScenario(),
                new ConcurrentOperationsScenario(),
                new StressScenario(),
                new EdgeCaseScenario(),
                new DisplayScenario(),
                new EndToEndScenario()
        );
    }

    /**
     * Resolves a comma-separated id list against the catalog, keeping catalog order.
     * A blank selection means the whole suite.
     */
    public static List<Scenario> select(String rawIds) {
        List<Scenario> all = defaults();
        if (rawIds == null || rawIds.isBlank()) {
            return all;
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String part : rawIds.split(",")) {
            String id = part.trim().toLowerCase(Locale.ROOT);
            if (!id.isEmpty()) {
                wanted.add(id);
            }
        }
        List<Scenario> out = new ArrayList<>();
        for (Scenario scenario : all) {
            if (wanted.remove(scenario.id())) {
                out.add(scenario);
            }
        }
        if (!wanted.isEmpty()) {
            throw new IllegalArgumentException("Unknown scenario id(s): " + String.join(", ", wanted));
        }
        return out;
    }

    public static List<String> declaredNames(List<Scenario> scenarios, HarnessSettings settings) {
        Set<String> names = new LinkedHashSet<>();
        for (Scenario scenario : scenarios) {
            names.addAll(scenario.sessionNames(settings));
        }
        return List.copyOf(names);
    }
}
