package org.duplex.host.gateway;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.StatusProto;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.javalin.http.HandlerType;
import io.javalin.http.HttpResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The gateway's route table. Gateway bindings register their routes here; every route is wrapped so
 * that a failure while serving it produces a {@code 500} response instead of escaping the listener.
 *
 * <p>{@link #unary} registers a transcoding route: the request message is assembled from the JSON body,
 * the path parameters and the query parameters (in that order, later sources win for singular fields),
 * the call is made over the given channel with the request's outbound metadata attached, and the
 * response message is rendered as JSON. A {@code Grpc-Timeout} request header sets the deadline of the
 * call; without one the configured default applies. gRPC errors are rendered as a JSON {@code google.rpc.Status}
 * with the HTTP status mapped by {@link GrpcHttpStatus}.</p>
 */
public final class GatewayRoutes {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayRoutes.class);

    static final String JSON = "application/json";
    static final String TEXT = "text/plain";
    static final String TIMEOUT_HEADER = "Grpc-Timeout";

    private static final Pattern TIMEOUT_PATTERN = Pattern.compile("(\\d{1,8})([HMSmun])");

    private static final JsonFormat.Parser JSON_PARSER = JsonFormat.parser().ignoringUnknownFields();
    private static final JsonFormat.Printer JSON_PRINTER = JsonFormat.printer().omittingInsignificantWhitespace();

    private final Javalin app;
    private final Duration defaultTimeout;
    private final List<String> routes = new ArrayList<>();

    GatewayRoutes(final Javalin app) {
        this(app, null);
    }

    /**
     * @param app            The application the routes are registered on.
     * @param defaultTimeout The deadline of transcoded calls without a {@code Grpc-Timeout} header, or
     *                       null for none.
     */
    GatewayRoutes(final Javalin app, final Duration defaultTimeout) {
        this.app = Objects.requireNonNull(app, "app");
        this.defaultTimeout = defaultTimeout == null || defaultTimeout.isZero() ? null : defaultTimeout;
    }

    /**
     * Registers a raw HTTP route.
     *
     * @param verb    One of GET, POST, PUT, PATCH or DELETE.
     * @param path    The Javalin path, e.g. {@code /v1/items/{id}}.
     * @param handler The handler serving the route.
     */
    public void handle(final HandlerType verb, final String path, final Handler handler) {
        final String route = verb + " " + path;
        final Handler recovering = recovering(route, handler);
        switch (verb) {
            case GET:
                app.get(path, recovering);
                break;
            case POST:
                app.post(path, recovering);
                break;
            case PUT:
                app.put(path, recovering);
                break;
            case PATCH:
                app.patch(path, recovering);
                break;
            case DELETE:
                app.delete(path, recovering);
                break;
            default:
                throw new IllegalArgumentException("Unsupported gateway verb: " + verb);
        }
        routes.add(route);
        LOGGER.debug("Registered gateway route {}", route);
    }

    /**
     * Registers a route transcoding HTTP/JSON into a unary call.
     *
     * @param verb             The HTTP verb.
     * @param path             The Javalin path; path parameters are bound to request fields of the same name.
     * @param method           The unary method to call.
     * @param requestPrototype Any instance of the request type, used to create request builders.
     * @param channel          The channel to call on, normally the loopback channel handed to the binding.
     * @param <ReqT>           The request message type.
     * @param <RespT>          The response message type.
     */
    public <ReqT extends Message, RespT extends Message> void unary(final HandlerType verb,
                                                                    final String path,
                                                                    final MethodDescriptor<ReqT, RespT> method,
                                                                    final ReqT requestPrototype,
                                                                    final Channel channel) {
        if (method.getType() != MethodDescriptor.MethodType.UNARY) {
            throw new IllegalArgumentException("Method " + method.getFullMethodName() + " is not unary");
        }
        Objects.requireNonNull(requestPrototype, "requestPrototype");
        Objects.requireNonNull(channel, "channel");
        handle(verb, path, ctx -> serveUnary(ctx, method, requestPrototype, channel));
    }

    /**
     * @return The registered routes as {@code VERB path}, in registration order.
     */
    public List<String> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    private <ReqT extends Message, RespT extends Message> void serveUnary(final Context ctx,
                                                                          final MethodDescriptor<ReqT, RespT> method,
                                                                          final ReqT requestPrototype,
                                                                          final Channel channel) throws InvalidProtocolBufferException {
        final Message.Builder builder = requestPrototype.newBuilderForType();
        final CallOptions callOptions;
        try {
            callOptions = callOptions(ctx.header(TIMEOUT_HEADER));
            final String body = ctx.body();
            if (!body.isBlank()) {
                JSON_PARSER.merge(body, builder);
            }
            MessageFieldBinder.bindEach(builder, ctx.pathParamMap());
            MessageFieldBinder.bindAll(builder, ctx.queryParamMap());
        } catch (final InvalidProtocolBufferException | IllegalArgumentException e) {
            respondWithStatus(ctx, Status.INVALID_ARGUMENT.withDescription(e.getMessage()), null);
            return;
        }

        @SuppressWarnings("unchecked")
        final ReqT request = (ReqT) builder.build();
        final GatewayCallContext call = GatewayCallContext.of(ctx);
        final Channel target = ClientInterceptors.intercept(channel,
            MetadataUtils.newAttachHeadersInterceptor(call.getOutboundMetadata()));

        try {
            final RespT response = ClientCalls.blockingUnaryCall(target, method, callOptions, request);
            ctx.status(200).contentType(JSON).result(JSON_PRINTER.print(response));
        } catch (final StatusRuntimeException e) {
            respondWithStatus(ctx, e.getStatus(), e);
        }
    }

    private CallOptions callOptions(final String timeoutHeader) {
        final Duration timeout = timeoutHeader != null ? parseTimeout(timeoutHeader) : defaultTimeout;
        if (timeout == null) {
            return CallOptions.DEFAULT;
        }
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (final ArithmeticException e) {
            nanos = Long.MAX_VALUE;
        }
        return CallOptions.DEFAULT.withDeadlineAfter(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Parses a {@code Grpc-Timeout} value: up to eight digits followed by one of {@code H M S m u n}.
     *
     * @param value The header value.
     * @return The timeout.
     * @throws IllegalArgumentException if the value is malformed.
     */
    static Duration parseTimeout(final String value) {
        final Matcher matcher = TIMEOUT_PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid " + TIMEOUT_HEADER + " header: " + value);
        }
        final long amount = Long.parseLong(matcher.group(1));
        switch (matcher.group(2).charAt(0)) {
            case 'H':
                return Duration.ofHours(amount);
            case 'M':
                return Duration.ofMinutes(amount);
            case 'S':
                return Duration.ofSeconds(amount);
            case 'm':
                return Duration.ofMillis(amount);
            case 'u':
                return Duration.ofNanos(amount * 1000);
            default:
                return Duration.ofNanos(amount);
        }
    }

    private static void respondWithStatus(final Context ctx, final Status status, final StatusRuntimeException cause)
        throws InvalidProtocolBufferException {
        com.google.rpc.Status body = cause != null ? StatusProto.fromThrowable(cause) : null;
        if (body == null) {
            body = com.google.rpc.Status.newBuilder()
                .setCode(status.getCode().value())
                .setMessage(status.getDescription() != null ? status.getDescription() : status.getCode().name())
                .build();
        }
        ctx.status(GrpcHttpStatus.toHttpStatus(status.getCode())).contentType(JSON).result(JSON_PRINTER.print(body));
    }

    static Handler recovering(final String route, final Handler handler) {
        return ctx -> {
            try {
                handler.handle(ctx);
            } catch (final HttpResponseException e) {
                throw e;
            } catch (final Throwable t) {
                respondWithFailure(ctx, route, t);
            }
        };
    }

    static void respondWithFailure(final Context ctx, final String route, final Throwable failure) {
        LOGGER.error("Recovered from failure while serving {}", route, failure);
        ctx.status(500).contentType(TEXT).result(describe(failure));
    }

    static String describe(final Throwable failure) {
        final String message = failure.getMessage();
        return message != null && !message.isBlank() ? message : failure.getClass().getName();
    }
}
