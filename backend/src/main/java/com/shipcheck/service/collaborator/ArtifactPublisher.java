package com.shipcheck.service.collaborator;

import com.shipcheck.domain.FileSet;

/**
 * Pushes files to a hosting platform and exposes them at a public URL.
 * Round 1 creates the repository, later rounds update it.
 *
 * The production implementation is {@link HttpArtifactPublisher}.
 */
public interface ArtifactPublisher {

    /**
     * @throws PublishException               when the push or page setup fails
     * @throws EndpointNotConfiguredException when the publisher is not configured
     */
    Deployment publish(String repoName, String taskId, int round, FileSet files);
}
