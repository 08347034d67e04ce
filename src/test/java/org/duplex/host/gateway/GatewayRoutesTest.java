package org.duplex.host.gateway;

import com.google.protobuf.StringValue;
import io.grpc.Grpc;
import io.grpc.InsecureServerCredentials;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.stub.ServerCalls;
import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import org.duplex.host.TestServices;
import org.duplex.junit.extensions.logging.AllowLog;
import org.duplex.junit.extensions.logging.LogLevel;
import org.duplex.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tests the transcoding routes against a real gRPC server and a real Javalin listener.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = "org\\.eclipse\\.jetty.*")
class GatewayRoutesTest {

    private Server server;
    private ManagedChannel channel;
    private Javalin app;
    private GatewayRoutes routes;
    private boolean started;

    @BeforeEach
    void setUp() throws IOException {
        final HealthStatusManager health = new HealthStatusManager();
        health.setStatus("orders", io.grpc.health.v1.HealthCheckResponse.ServingStatus.SERVING);
        final ServerServiceDefinition denied = ServerServiceDefinition.builder("Denied")
            .addMethod(TestServices.echoMethod("Denied"), ServerCalls.asyncUnaryCall((request, observer) ->
                observer.onError(Status.PERMISSION_DENIED.withDescription("not for you").asRuntimeException())))
            .build();
        final ServerServiceDefinition slow = ServerServiceDefinition.builder("Slow")
            .addMethod(TestServices.echoMethod("Slow"), ServerCalls.asyncUnaryCall((request, observer) -> {
                // Never answers; the caller's deadline ends the call.
            }))
            .build();
        server = Grpc.newServerBuilderForPort(0, InsecureServerCredentials.create())
            .addService(health.getHealthService())
            .addService(denied)
            .addService(slow)
            .build()
            .start();
        channel = TestServices.dial(server.getPort());
        app = Javalin.create(config -> config.showJavalinBanner = false);
        routes = new GatewayRoutes(app);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (started) {
            app.stop();
        }
        TestServices.close(channel);
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void unary_rendersResponseAsJson() {
        routes.unary(HandlerType.GET, "/health/{service}", HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), channel);
        start();

        given().port(port())
            .when().get("/health/orders")
            .then().statusCode(200).contentType(containsString("application/json")).body("status", equalTo("SERVING"));
    }

    @Test
    void unary_mapsGrpcErrorsToHttpStatus() {
        routes.unary(HandlerType.GET, "/health/{service}", HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), channel);
        routes.unary(HandlerType.POST, "/denied", TestServices.echoMethod("Denied"), StringValue.getDefaultInstance(), channel);
        start();

        given().port(port())
            .when().get("/health/unknown")
            .then().statusCode(404).body("code", equalTo(Status.Code.NOT_FOUND.value()));
        given().port(port()).body("\"x\"")
            .when().post("/denied")
            .then().statusCode(403).body("code", equalTo(7)).body("message", equalTo("not for you"));
    }

    @Test
    void unary_unreachableBackend_isServiceUnavailable() throws Exception {
        final int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        final ManagedChannel unreachable = TestServices.dial(closedPort);
        try {
            routes.unary(HandlerType.GET, "/health", HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), unreachable);
            start();

            given().port(port())
                .when().get("/health")
                .then().statusCode(503).body("code", equalTo(Status.Code.UNAVAILABLE.value()));
        } finally {
            TestServices.close(unreachable);
        }
    }

    @Test
    void unary_queryParametersAndMalformedBody() {
        routes.unary(HandlerType.GET, "/health", HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), channel);
        routes.unary(HandlerType.POST, "/health", HealthGrpc.getCheckMethod(), HealthCheckRequest.getDefaultInstance(), channel);
        start();

        given().port(port()).queryParam("service", "orders")
            .when().get("/health")
            .then().statusCode(200).body("status", equalTo("SERVING"));
        given().port(port()).contentType("application/json").body("[1, 2]")
            .when().post("/health")
            .then().statusCode(400).body("code", equalTo(3));
    }

    @Test
    void unary_timeoutHeader_boundsTheCall() {
        routes.unary(HandlerType.POST, "/slow", TestServices.echoMethod("Slow"), StringValue.getDefaultInstance(), channel);
        start();

        given().port(port()).header(GatewayRoutes.TIMEOUT_HEADER, "200m").body("\"x\"")
            .when().post("/slow")
            .then().statusCode(504).body("code", equalTo(Status.Code.DEADLINE_EXCEEDED.value()));
        given().port(port()).header(GatewayRoutes.TIMEOUT_HEADER, "soon").body("\"x\"")
            .when().post("/slow")
            .then().statusCode(400).body("code", equalTo(Status.Code.INVALID_ARGUMENT.value()));
    }

    @Test
    void unary_defaultTimeout_appliesWithoutHeader() {
        routes = new GatewayRoutes(app, Duration.ofMillis(200));
        routes.unary(HandlerType.POST, "/slow", TestServices.echoMethod("Slow"), StringValue.getDefaultInstance(), channel);
        start();

        given().port(port()).body("\"x\"")
            .when().post("/slow")
            .then().statusCode(504);
    }

    @Test
    void parseTimeout_readsEveryUnit() {
        assertThat(GatewayRoutes.parseTimeout("2H")).isEqualTo(Duration.ofHours(2));
        assertThat(GatewayRoutes.parseTimeout("3M")).isEqualTo(Duration.ofMinutes(3));
        assertThat(GatewayRoutes.parseTimeout("5S")).isEqualTo(Duration.ofSeconds(5));
        assertThat(GatewayRoutes.parseTimeout("250m")).isEqualTo(Duration.ofMillis(250));
        assertThat(GatewayRoutes.parseTimeout("7u")).isEqualTo(Duration.ofNanos(7000));
        assertThat(GatewayRoutes.parseTimeout("9n")).isEqualTo(Duration.ofNanos(9));
        assertThatThrownBy(() -> GatewayRoutes.parseTimeout("123456789S")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GatewayRoutes.parseTimeout("5s")).isInstanceOf(IllegalArgumentException.class);
    }

    private void start() {
        app.start(0);
        started = true;
    }

    private int port() {
        return app.port();
    }

    @Test
    void unary_rejectsStreamingMethods() {
        assertThatThrownBy(() -> routes.unary(HandlerType.GET, "/watch", HealthGrpc.getWatchMethod(),
            HealthCheckRequest.getDefaultInstance(), channel))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Watch");
    }

    @Test
    void handle_recordsRoutesInOrder() {
        routes.handle(HandlerType.GET, "/a", ctx -> ctx.result("a"));
        routes.handle(HandlerType.DELETE, "/b/{id}", ctx -> ctx.status(204));
        routes.unary(HandlerType.POST, "/c", TestServices.echoMethod("Denied"), StringValue.getDefaultInstance(), channel);

        assertThat(routes.getRoutes()).containsExactly("GET /a", "DELETE /b/{id}", "POST /c");
        assertThatThrownBy(() -> routes.handle(HandlerType.HEAD, "/d", ctx -> ctx.result("d")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describe_fallsBackToClassName() {
        assertThat(GatewayRoutes.describe(new IllegalStateException("boom"))).isEqualTo("boom");
        assertThat(GatewayRoutes.describe(new IllegalStateException(" "))).isEqualTo("java.lang.IllegalStateException");
        assertThat(GatewayRoutes.describe(new RuntimeException())).isEqualTo("java.lang.RuntimeException");
    }
}
