package io.muxharness.scenario;

import io.muxharness.config.HarnessSettings;

import java.util.List;

public interface Scenario {
    String id();

    String title();

    /**
     * Every session name this scenario may create with the given settings. The final
     * sweep kills all of them even when {@link #run} never got that far.
     */
    List<String> sessionNames(HarnessSettings settings);

    void run(ScenarioContext ctx);
}
