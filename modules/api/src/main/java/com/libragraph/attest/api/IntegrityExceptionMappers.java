package com.libragraph.attest.api;

import com.libragraph.attest.core.baseline.BaselineNotFoundException;
import com.libragraph.attest.core.manifest.MissingCriticalFileException;
import com.libragraph.attest.core.pipeline.CertificationPipelineException;
import com.libragraph.attest.core.pipeline.RunStateException;
import com.libragraph.attest.core.verify.IncomparableFingerprintException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps domain failures to HTTP statuses with a JSON body.
 */
public class IntegrityExceptionMappers {

    private static final Logger log = Logger.getLogger(IntegrityExceptionMappers.class);

    @ServerExceptionMapper
    public Response baselineNotFound(BaselineNotFoundException e) {
        return error(Response.Status.NOT_FOUND, ErrorResponse.of("baseline_not_found", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response pipelineHalted(CertificationPipelineException e) {
        return error(422, new ErrorResponse("certification_halted", e.reason(), e.runId(), e.stage().name()));
    }

    @ServerExceptionMapper
    public Response missingCritical(MissingCriticalFileException e) {
        return error(422, ErrorResponse.of("missing_critical_file", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response incomparable(IncomparableFingerprintException e) {
        return error(Response.Status.CONFLICT, ErrorResponse.of("incomparable_fingerprint", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response runState(RunStateException e) {
        return error(Response.Status.CONFLICT,
                new ErrorResponse("conflict", e.getMessage(), e.runId(), e.stage().name()));
    }

    @ServerExceptionMapper
    public Response invalidInput(IllegalArgumentException e) {
        log.debugf("Rejected request: %s", e.getMessage());
        return error(Response.Status.BAD_REQUEST, ErrorResponse.of("invalid_request", e.getMessage()));
    }

    private static Response error(Response.Status status, ErrorResponse body) {
        return error(status.getStatusCode(), body);
    }

    private static Response error(int status, ErrorResponse body) {
        return Response.status(status).entity(body).type(MediaType.APPLICATION_JSON_TYPE).build();
    }
}
