package io.muxharness.process;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class ProcessTargetRunnerTest {
    private static final Duration GENEROUS = Duration.ofSeconds(30);

    @Test
    void capturesExitCodeAndBothStreams() {
        ProcessTargetRunner runner = new ProcessTargetRunner(fakeTarget());

        Outcome outcome = runner.run(Invocation.of(GENEROUS, "echo", "hello-out", "hello-err", "3"));

        Outcome.Completed completed = outcome.asCompleted().orElseThrow();
        Assertions.assertEquals(3, completed.exitCode());
        Assertions.assertEquals("hello-out", completed.stdout().strip());
        Assertions.assertEquals("hello-err", completed.stderr().strip());
        Assertions.assertFalse(outcome.succeeded());
        Assertions.assertTrue(outcome.signalsError());
    }

    @Test
    void zeroExitIsSuccess() {
        ProcessTargetRunner runner = new ProcessTargetRunner(fakeTarget());

        Outcome outcome = runner.run(Invocation.of(GENEROUS, "echo", "fine", "-", "0"));

        Assertions.assertTrue(outcome.succeeded());
        Assertions.assertTrue(outcome.hasOutput());
    }

    @Test
    void hungTargetIsAbandonedAfterTimeout() {
        ProcessTargetRunner runner = new ProcessTargetRunner(fakeTarget());

        long started = System.nanoTime();
        Outcome outcome = runner.run(Invocation.of(Duration.ofSeconds(2), "sleep", "60000"));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertTrue(outcome.timedOut());
        Assertions.assertFalse(outcome.succeeded());
        Assertions.assertFalse(outcome.signalsError());
        Assertions.assertTrue(elapsedMs < 20_000L, "took " + elapsedMs + " ms");
    }

    @Test
    void largeOutputDoesNotBlockTheChild() {
        ProcessTargetRunner runner = new ProcessTargetRunner(fakeTarget());

        Outcome outcome = runner.run(Invocation.of(GENEROUS, "flood", "1000000"));

        Assertions.assertTrue(outcome.succeeded());
        Assertions.assertEquals(1_000_000, outcome.stdout().length());
    }

    @Test
    void pipesHeldByAForkedChildDoNotHoldUpTheResult() {
        ProcessTargetRunner runner = new ProcessTargetRunner(fakeTarget());

        long started = System.nanoTime();
        Outcome first = runner.run(Invocation.of(GENEROUS, "orphan", "20000"));
        Outcome second = runner.run(Invocation.of(GENEROUS, "orphan", "20000"));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertTrue(first.succeeded());
        Assertions.assertEquals("parent-done", first.stdout().strip());
        Assertions.assertTrue(second.succeeded());
        Assertions.assertTrue(elapsedMs < 12_000L, "took " + elapsedMs + " ms");
    }

    @Test
    void missingBinaryRaisesSpawnFailure() {
        ProcessTargetRunner runner = new ProcessTargetRunner(List.of("/nonexistent/muxharness-target-binary"));

        Assertions.assertThrows(TargetSpawnException.class,
                () -> runner.run(Invocation.of(GENEROUS, "--version")));
        Assertions.assertThrows(TargetSpawnException.class,
                () -> runner.spawnDetached(List.of("new-session", "-s", "x", "-d")));
    }

    @Test
    void detachedSpawnReturnsWithoutWaiting() {
        ProcessTargetRunner runner = new ProcessTargetRunner(fakeTarget());

        long started = System.nanoTime();
        runner.spawnDetached(List.of("sleep", "15000"));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertTrue(elapsedMs < 10_000L, "took " + elapsedMs + " ms");
    }

    @Test
    void emptyTargetCommandIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ProcessTargetRunner(List.of()));
    }

    private static List<String> fakeTarget() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java, "-cp", System.getProperty("java.class.path"), FakeTargetMain.class.getName());
    }
}
