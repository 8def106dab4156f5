package com.libragraph.attest.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.attest.core.storage.AttestJson;
import io.quarkus.jackson.ObjectMapperCustomizer;
import jakarta.inject.Singleton;

/**
 * Renders content hashes as lowercase hex in REST payloads, as in the stored documents.
 */
@Singleton
public class AttestObjectMapperCustomizer implements ObjectMapperCustomizer {

    @Override
    public void customize(ObjectMapper mapper) {
        mapper.registerModule(AttestJson.contentHashModule());
    }
}
