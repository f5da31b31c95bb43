package com.shipcheck.service.collaborator;

import com.shipcheck.domain.FileSet;
import com.shipcheck.infra.OutboundHttp;
import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.MediaType;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.serde.annotation.Serdeable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Calls the publishing service over HTTP:
 *   POST {publisher.url}  {repoName, task, round, files}
 *   →    {repoUrl, commitSha, pagesUrl}
 *
 * The publisher waits for the page to come up before answering, so the
 * timeout is generous.
 */
@Singleton
public class HttpArtifactPublisher implements ArtifactPublisher {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactPublisher.class);

    @Value("${publisher.url:}")
    String publisherUrl;

    @Value("${publisher.timeout:330s}")
    Duration timeout;

    @Serdeable
    public record PublishRequest(String repoName, String task, int round, Map<String, String> files) {}

    @Override
    public Deployment publish(String repoName, String taskId, int round, FileSet files) {
        URI target = OutboundHttp.parse(publisherUrl);
        if (target == null) {
            throw new EndpointNotConfiguredException("publisher.url");
        }

        Deployment deployment;
        try (HttpClient client = OutboundHttp.create(target, timeout)) {
            deployment = client.toBlocking().retrieve(
                HttpRequest.POST(OutboundHttp.pathOf(target), new PublishRequest(repoName, taskId, round, files.asMap()))
                    .contentType(MediaType.APPLICATION_JSON_TYPE),
                Deployment.class);
        } catch (HttpClientResponseException e) {
            throw new PublishException("Publisher returned HTTP " + e.getStatus().getCode(), e);
        } catch (Exception e) {
            throw new PublishException("Publisher call failed: " + e.getMessage(), e);
        }

        if (deployment == null || deployment.repoUrl() == null) {
            throw new PublishException("Publisher returned no repository URL");
        }
        log.info("Published {} at {} (commit {})", repoName, deployment.repoUrl(), deployment.commitSha());
        return deployment;
    }
}
