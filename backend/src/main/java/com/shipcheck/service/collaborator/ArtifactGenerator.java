package com.shipcheck.service.collaborator;

import com.shipcheck.domain.FileSet;
import com.shipcheck.dto.BuildRequest;

/**
 * Turns a brief into artifact files. Later rounds revise the files already
 * published for the same task.
 *
 * The production implementation is {@link HttpArtifactGenerator}.
 */
public interface ArtifactGenerator {

    /**
     * @throws GenerationException            when no files could be produced
     * @throws EndpointNotConfiguredException when the generator is not configured
     */
    FileSet generate(BuildRequest request);
}
