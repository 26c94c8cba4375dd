/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.reachcheck.monitor;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.reachcheck.config.ReachCheckProperties;
import de.makibytes.reachcheck.model.JobEvent;
import de.makibytes.reachcheck.model.Metadata;

/**
 * Decides whether a job deploys one of the approved images. Out-of-scope jobs are not errors.
 */
@Component
public class MetadataFilter {

    private static final Logger logger = LoggerFactory.getLogger(MetadataFilter.class);

    private final Set<String> allowedImageUrls;
    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    public MetadataFilter(ReachCheckProperties properties) {
        this.allowedImageUrls = Set.copyOf(new LinkedHashSet<>(properties.getVerification().getAllowedImageUrls()));
    }

    public Optional<Metadata> inScope(JobEvent event) {
        Metadata metadata = parse(event.declaredMetadata());
        if (metadata == null) {
            return Optional.empty();
        }
        String url = metadata.imageUrl();
        if (url == null) {
            logger.info("No URL found in metadata of job {}, skipping deployment checks", event.jobId());
            return Optional.empty();
        }
        if (!allowedImageUrls.contains(url)) {
            logger.info("Job {} does not use an approved image. URL in metadata: {}", event.jobId(), url);
            return Optional.empty();
        }
        return Optional.of(metadata);
    }

    Metadata parse(String declaredMetadata) {
        if (declaredMetadata == null || declaredMetadata.isBlank()) {
            logger.warn("Empty job metadata");
            return null;
        }
        try {
            Metadata metadata = mapper.readValue(declaredMetadata, Metadata.class);
            if (metadata == null) {
                logger.warn("Job metadata is JSON null | raw: {}", declaredMetadata);
            }
            return metadata;
        } catch (JsonProcessingException ex) {
            logger.warn("Failed to parse metadata JSON: {} | raw: {}", ex.getOriginalMessage(), declaredMetadata);
            return null;
        }
    }
}
