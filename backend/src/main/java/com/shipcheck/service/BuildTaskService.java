package com.shipcheck.service;

import com.shipcheck.domain.FileSet;
import com.shipcheck.dto.BuildRequest;
import com.shipcheck.dto.BuildResponse;
import com.shipcheck.dto.NotificationPayload;
import com.shipcheck.dto.ValidationReport;
import com.shipcheck.service.collaborator.ArtifactGenerator;
import com.shipcheck.service.collaborator.ArtifactPublisher;
import com.shipcheck.service.collaborator.Deployment;
import com.shipcheck.service.collaborator.PublishException;
import com.shipcheck.service.notify.NotificationDispatcher;
import com.shipcheck.service.validator.ValidationOrchestrator;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

/**
 * Runs one build request end to end:
 *
 *   accept   → 403 on bad credentials, otherwise queued and acknowledged
 *   process  → generate → validate files → publish → validate live page → notify
 *
 * Validation never gates publishing. Every request ends with a callback:
 * a generator or publisher failure is reported with its partial report and
 * null repo_url, commit_sha and pages_url.
 */
@Singleton
public class BuildTaskService {

    private static final Logger log = LoggerFactory.getLogger(BuildTaskService.class);

    @Inject ArtifactGenerator generator;
    @Inject ArtifactPublisher publisher;
    @Inject ValidationOrchestrator orchestrator;
    @Inject NotificationDispatcher dispatcher;

    @Inject
    @Named(TaskExecutors.IO)
    ExecutorService executor;

    @Value("${app.email:}")
    String expectedEmail;

    @Value("${app.secret:}")
    String expectedSecret;

    public BuildResponse accept(BuildRequest req) {
        if (!expectedEmail.equals(req.email()) || !expectedSecret.equals(req.secret())) {
            log.warn("Rejected build request for task {}: credentials do not match", req.task());
            throw new HttpStatusException(HttpStatus.FORBIDDEN, "Invalid email or secret");
        }

        log.info("Accepted task {} round {} ({} checks, {} attachments)",
            req.task(), req.round(), req.checks().size(), req.attachmentsOrEmpty().size());
        executor.submit(() -> process(req));
        return new BuildResponse("accepted", "Task " + req.task() + " round " + req.round() + " queued");
    }

    /**
     * The background half of a build. Returns the final report, or the
     * partial report of the stage that stopped the task. Never throws.
     */
    public ValidationReport process(BuildRequest req) {
        ValidationReport report;
        FileSet files;
        try {
            files = generator.generate(req);
            report = orchestrator.validateGenerated(files, req.checks());
        } catch (Exception e) {
            log.error("✗ Generation failed for task {}: {}", req.task(), e.getMessage(), e);
            report = orchestrator.validateGenerationFailure(e.getMessage(), req.checks());
            orchestrator.complete(report);
            dispatcher.dispatch(req.task(), req.evaluationUrl(), NotificationPayload.undeployed(req, report));
            return report;
        }

        Deployment deployment;
        try {
            deployment = publisher.publish(repoName(req.task()), req.task(), req.round(), files);
            if (deployment == null) {
                throw new PublishException("Publisher returned no deployment");
            }
        } catch (Exception e) {
            log.error("✗ Publishing failed for task {}: {}", req.task(), e.getMessage(), e);
            orchestrator.complete(report);
            dispatcher.dispatch(req.task(), req.evaluationUrl(), NotificationPayload.undeployed(req, report));
            return report;
        }

        report = orchestrator.validateLive(report, deployment.pagesUrl(), req.checks());
        orchestrator.complete(report);

        dispatcher.dispatch(req.task(), req.evaluationUrl(), NotificationPayload.of(req, deployment, report));
        return report;
    }

    /** Task id with dots and underscores turned into hyphens. */
    public static String repoName(String taskId) {
        return taskId.replace('.', '-').replace('_', '-');
    }
}
