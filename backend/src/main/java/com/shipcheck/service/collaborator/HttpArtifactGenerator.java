package com.shipcheck.service.collaborator;

import com.shipcheck.domain.FileSet;
import com.shipcheck.dto.Attachment;
import com.shipcheck.dto.BuildRequest;
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
import java.util.List;
import java.util.Map;

/**
 * Calls the code-generation service over HTTP:
 *   POST {generator.url}  {task, round, brief, checks, attachments}
 *   →    {files: {name: content}}
 */
@Singleton
public class HttpArtifactGenerator implements ArtifactGenerator {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactGenerator.class);

    @Value("${generator.url:}")
    String generatorUrl;

    @Value("${generator.timeout:300s}")
    Duration timeout;

    @Serdeable
    public record GenerateRequest(String task, int round, String brief, List<String> checks, List<Attachment> attachments) {}

    @Serdeable
    public record GenerateResponse(Map<String, String> files) {}

    @Override
    public FileSet generate(BuildRequest request) {
        URI target = OutboundHttp.parse(generatorUrl);
        if (target == null) {
            throw new EndpointNotConfiguredException("generator.url");
        }

        GenerateRequest body = new GenerateRequest(request.task(), request.round(), request.brief(),
            request.checks(), request.attachmentsOrEmpty());

        GenerateResponse response;
        try (HttpClient client = OutboundHttp.create(target, timeout)) {
            response = client.toBlocking().retrieve(
                HttpRequest.POST(OutboundHttp.pathOf(target), body).contentType(MediaType.APPLICATION_JSON_TYPE),
                GenerateResponse.class);
        } catch (HttpClientResponseException e) {
            throw new GenerationException("Generator returned HTTP " + e.getStatus().getCode(), e);
        } catch (Exception e) {
            throw new GenerationException("Generator call failed: " + e.getMessage(), e);
        }

        if (response == null || response.files() == null || response.files().isEmpty()) {
            throw new GenerationException("Generator returned no files");
        }
        log.info("Generated {} files for task {} (round {})", response.files().size(), request.task(), request.round());
        return FileSet.of(response.files());
    }
}
