package org.duplex.host.gateway;

import io.grpc.Status;

/**
 * Maps gRPC status codes to the HTTP status codes the gateway responds with.
 */
public final class GrpcHttpStatus {

    /**
     * Non-standard status for requests cancelled by the client.
     */
    public static final int CLIENT_CLOSED_REQUEST = 499;

    private GrpcHttpStatus() {
        // Private constructor to prevent instantiation
    }

    public static int toHttpStatus(final Status.Code code) {
        switch (code) {
            case OK:
                return 200;
            case CANCELLED:
                return CLIENT_CLOSED_REQUEST;
            case INVALID_ARGUMENT:
            case FAILED_PRECONDITION:
            case OUT_OF_RANGE:
                return 400;
            case UNAUTHENTICATED:
                return 401;
            case PERMISSION_DENIED:
                return 403;
            case NOT_FOUND:
                return 404;
            case ALREADY_EXISTS:
            case ABORTED:
                return 409;
            case RESOURCE_EXHAUSTED:
                return 429;
            case UNIMPLEMENTED:
                return 501;
            case UNAVAILABLE:
                return 503;
            case DEADLINE_EXCEEDED:
                return 504;
            case UNKNOWN:
            case INTERNAL:
            case DATA_LOSS:
            default:
                return 500;
        }
    }
}
