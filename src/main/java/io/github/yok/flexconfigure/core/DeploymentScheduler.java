package io.github.yok.flexconfigure.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.flexconfigure.model.DeploymentTask;
import io.github.yok.flexconfigure.model.RunStats;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;

/**
 * Deployment phase: runs every queued {@link DeploymentTask} concurrently.
 *
 * <p>
 * Tasks are grouped by effective package id. Each package gets its own {@link Semaphore} of
 * {@code parallelDeployments} permits, so at most that many tasks of the same package deploy at
 * once. Packages are not bounded against each other; with several packages the total number of
 * concurrent deployments can exceed {@code parallelDeployments}.
 * </p>
 *
 * <p>
 * Workers only publish their {@link DeploymentOutcome} to a results queue sized to the number of
 * tasks. After every worker has finished, the calling thread drains the queue and is the only
 * writer of {@link RunStats}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DeploymentScheduler {

    private final ArtifactDeployer deployer;
    private final int parallelDeployments;

    public DeploymentScheduler(ArtifactDeployer deployer, int parallelDeployments) {
        this.deployer = deployer;
        this.parallelDeployments = parallelDeployments;
    }

    /**
     * Deploys all tasks and records the outcomes.
     *
     * @param tasks tasks queued by the configuration phase
     * @param stats run statistics, updated after all workers finished
     * @return outcomes in completion order
     */
    public List<DeploymentOutcome> deployAll(List<DeploymentTask> tasks, RunStats stats) {
        if (tasks.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, List<DeploymentTask>> byPackage = new LinkedHashMap<>();
        for (DeploymentTask task : tasks) {
            byPackage.computeIfAbsent(task.getPackageId(), k -> new ArrayList<>()).add(task);
        }
        log.info("Deploying artifacts across {} package(s)", byPackage.size());

        BlockingQueue<DeploymentOutcome> results = new ArrayBlockingQueue<>(tasks.size());
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size(),
                new ThreadFactoryBuilder().setNameFormat("deploy-%d").setDaemon(true).build());
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (Map.Entry<String, List<DeploymentTask>> entry : byPackage.entrySet()) {
                log.info("Package {}: deploying {} artifact(s)", entry.getKey(),
                        entry.getValue().size());
                Semaphore gate = new Semaphore(parallelDeployments);
                for (DeploymentTask task : entry.getValue()) {
                    futures.add(CompletableFuture
                            .runAsync(() -> results.add(runGated(gate, task)), executor));
                }
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } finally {
            executor.shutdown();
        }

        List<DeploymentOutcome> outcomes = new ArrayList<>(tasks.size());
        results.drainTo(outcomes);
        for (DeploymentOutcome outcome : outcomes) {
            String artifactId = outcome.getTask().getArtifactId();
            if (outcome.isSuccess()) {
                log.info("  Successfully deployed {}", artifactId);
                stats.deploymentSucceeded();
            } else {
                log.error("  Failed to deploy {}: {}", artifactId, outcome.getMessage());
                stats.deploymentFailed();
            }
        }
        return outcomes;
    }

    private DeploymentOutcome runGated(Semaphore gate, DeploymentTask task) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeploymentOutcome.failed(task,
                    "interrupted while waiting for a deployment slot");
        }
        try {
            return deployer.deploy(task);
        } catch (RuntimeException e) {
            log.error("  Unexpected error while deploying {}", task.getArtifactId(), e);
            return DeploymentOutcome.failed(task, "unexpected error: " + e.getMessage());
        } finally {
            gate.release();
        }
    }
}
