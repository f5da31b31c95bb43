package com.shipcheck.service.collaborator;

import io.micronaut.serde.annotation.Serdeable;
import jakarta.annotation.Nullable;

/**
 * Where the publisher put the artifact. {@code pagesUrl} is null when the
 * hosting platform did not expose a page.
 */
@Serdeable
public record Deployment(String repoUrl, String commitSha, @Nullable String pagesUrl) {}
