package org.duplex.host.gateway;

import io.grpc.Status;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class GrpcHttpStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "OK, 200",
        "CANCELLED, 499",
        "UNKNOWN, 500",
        "INVALID_ARGUMENT, 400",
        "DEADLINE_EXCEEDED, 504",
        "NOT_FOUND, 404",
        "ALREADY_EXISTS, 409",
        "PERMISSION_DENIED, 403",
        "UNAUTHENTICATED, 401",
        "RESOURCE_EXHAUSTED, 429",
        "FAILED_PRECONDITION, 400",
        "ABORTED, 409",
        "OUT_OF_RANGE, 400",
        "UNIMPLEMENTED, 501",
        "INTERNAL, 500",
        "UNAVAILABLE, 503",
        "DATA_LOSS, 500"
    })
    void toHttpStatus_mapsEveryCode(final Status.Code code, final int expected) {
        assertThat(GrpcHttpStatus.toHttpStatus(code)).isEqualTo(expected);
    }

    @Test
    void toHttpStatus_coversAllCodes() {
        for (final Status.Code code : Status.Code.values()) {
            assertThat(GrpcHttpStatus.toHttpStatus(code)).isBetween(200, 599);
        }
    }
}
