package org.apisrv.http.pipeline;

import io.netty.channel.ChannelHandlerContext;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apisrv.common.HttpMethod;
import org.apisrv.exception.BadRequestException;
import org.apisrv.exception.HttpException;
import org.apisrv.exception.InvalidValidatorResultException;
import org.apisrv.exception.MethodNotAllowedException;
import org.apisrv.exception.RouteNotFoundException;
import org.apisrv.http.request.ContentNegotiator;
import org.apisrv.http.request.QueryParams;
import org.apisrv.http.request.ReceivedRequest;
import org.apisrv.http.response.JsonResponder;
import org.apisrv.http.routing.HandlerOptions;
import org.apisrv.http.routing.RouteMatch;
import org.apisrv.http.routing.Router;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs a fully read request through its stages, strictly in order:
 * route resolution, authentication, path parameters, query parameters, body parameters,
 * merge, merged-parameter validation and finally the handler. The first failing stage
 * ends the request with one JSON error response.
 */
@Slf4j
public class RequestPipeline {

    private final Router router;
    private final ContentNegotiator negotiator;
    private final JsonResponder responder;
    private final Authenticator authenticator;
    private final RequestHandler fallbackHandler;
    private final UpgradeHandler upgradeHandler;
    private final Executor executor;
    private final boolean debug;

    @Builder
    private RequestPipeline(Router router, JsonResponder responder, Authenticator authenticator,
                            RequestHandler fallbackHandler, UpgradeHandler upgradeHandler, Executor executor,
                            boolean debug) {
        this.router = router;
        this.responder = responder;
        this.negotiator = new ContentNegotiator(responder.getObjectMapper());
        this.authenticator = authenticator != null ? authenticator : Authenticator.ALLOW_ALL;
        this.fallbackHandler = fallbackHandler;
        this.upgradeHandler = upgradeHandler;
        this.executor = executor != null ? executor : Runnable::run;
        this.debug = debug;
    }

    public CompletableFuture<Void> process(ReceivedRequest request) {
        RequestContext context = newContext(request);
        return CompletableFuture.supplyAsync(() -> context, executor)
                .thenCompose(this::run)
                .handle((ignored, error) -> {
                    if (error != null) {
                        respondWithError(context, unwrap(error));
                    }
                    return null;
                });
    }

    /**
     * Authenticates an upgrade request and hands the connection to the upgrade handler.
     * The connection is closed if authentication denies it or anything fails.
     */
    public CompletableFuture<Void> upgrade(ReceivedRequest request, ChannelHandlerContext channel) {
        RequestContext context = newContext(request);
        return CompletableFuture.supplyAsync(() -> context, executor)
                .thenCompose(ctx -> {
                    ctx.setUrlParams(QueryParams.parse(ctx.getQueryString()));
                    ctx.setParams(new LinkedHashMap<>(ctx.getUrlParams()));
                    return authenticate(ctx);
                })
                .thenCompose(allowed -> {
                    if (!allowed) {
                        log.debug("Upgrade denied (resource: {})", context.getUrl());
                        channel.close();
                        return CompletableFuture.completedFuture(false);
                    }
                    return call(() -> upgradeHandler.upgrade(context, channel, request.head()));
                })
                .handle((upgraded, error) -> {
                    if (error != null) {
                        log.warn("Upgrade failed (resource: {})", context.getUrl(), unwrap(error));
                        channel.close();
                    } else if (Boolean.TRUE.equals(upgraded) && debug) {
                        log.info("Upgrade successfully processed (resource: {})", context.getUrl());
                    }
                    return null;
                });
    }

    public boolean isUpgradeEnabled() {
        return upgradeHandler != null;
    }

    private RequestContext newContext(ReceivedRequest request) {
        return new RequestContext(request.method(), request.uri(), request.headers(), request.body(),
                request.sink(), responder);
    }

    private CompletionStage<Void> run(RequestContext context) {
        HttpMethod method = HttpMethod.find(context.getMethod());
        if (method == null) {
            throw new MethodNotAllowedException("Only GET, POST, PUT, and DELETE are allowed.");
        }
        Optional<RouteMatch> match = router.findRoute(method, context.getUrl());
        RequestHandler handler;
        HandlerOptions options;
        Map<String, Object> pathParams;
        if (match.isPresent()) {
            handler = match.get().route().handler();
            options = match.get().route().options();
            pathParams = new LinkedHashMap<>(match.get().pathParams());
        } else if (fallbackHandler != null) {
            handler = fallbackHandler;
            options = HandlerOptions.NONE;
            pathParams = new LinkedHashMap<>();
        } else if (router.hasOtherMethodMatch(method, context.getUrl())) {
            throw new MethodNotAllowedException("No handler for " + method + " " + context.getUrl());
        } else {
            throw new RouteNotFoundException("No handler for " + context.getUrl());
        }

        return authenticate(context).thenCompose(allowed -> {
            if (!allowed) {
                onDenied(context);
                return CompletableFuture.<Void>completedFuture(null);
            }
            return validate(options.getPathParamsValidator(), pathParams)
                    .thenCompose(validated -> {
                        context.setPathParams(validated);
                        negotiator.checkQueryPlacement(method, context.getRawUrl());
                        if (options.isIgnoreUrlParams()) {
                            return CompletableFuture.<Map<String, Object>>completedFuture(null);
                        }
                        return validate(options.getUrlParamsValidator(),
                                negotiator.urlParams(method, context.getRawUrl()));
                    })
                    .thenCompose(validated -> {
                        context.setUrlParams(validated);
                        Map<String, Object> bodyParams =
                                negotiator.bodyParams(method, context.getHeaders(), context.getBody());
                        if (bodyParams == null) {
                            return CompletableFuture.<Map<String, Object>>completedFuture(null);
                        }
                        return validate(options.getBodyParamsValidator(), bodyParams);
                    })
                    .thenCompose(validated -> {
                        context.setBodyParams(validated);
                        ParameterMerger.merge(context);
                        return validate(options.getParamsValidator(), context.getParams());
                    })
                    .thenCompose(validated -> {
                        context.setParams(validated);
                        return invoke(handler, context);
                    });
        });
    }

    private CompletableFuture<Boolean> authenticate(RequestContext context) {
        return call(() -> authenticator.authenticate(context)).thenApply(Boolean.TRUE::equals);
    }

    private void onDenied(RequestContext context) {
        if (debug) {
            log.info("Authentication failed (resource: {})", context.getUrl());
        }
        if (!context.getSink().isCommitted()) {
            context.getSink().abort();
        }
    }

    private CompletableFuture<Map<String, Object>> validate(ParamsValidator validator, Map<String, Object> params) {
        if (validator == null) {
            return CompletableFuture.completedFuture(params);
        }
        CompletionStage<Map<String, Object>> result;
        try {
            result = validator.validate(params);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new BadRequestException(e.getMessage(), e));
        }
        if (result == null) {
            return CompletableFuture.failedFuture(
                    new InvalidValidatorResultException("Validator did not return a parameter object."));
        }
        return result.toCompletableFuture().handle((value, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                throw new BadRequestException(cause.getMessage(), cause);
            }
            if (value == null) {
                throw new InvalidValidatorResultException("Validator did not return a parameter object.");
            }
            return value;
        });
    }

    private CompletionStage<Void> invoke(RequestHandler handler, RequestContext context) {
        CompletionStage<?> result;
        try {
            result = handler.handle(context);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new HandlerFailureException(e));
        }
        if (result == null) {
            return CompletableFuture.completedFuture(null);
        }
        return result.toCompletableFuture().handle((value, error) -> {
            if (error != null) {
                throw new HandlerFailureException(unwrap(error));
            }
            if (debug) {
                log.info("Request successfully processed (resource: {})", context.getUrl());
            }
            return null;
        });
    }

    private void respondWithError(RequestContext context, Throwable error) {
        int status;
        String detail;
        if (error instanceof HttpException httpException) {
            status = httpException.getStatus();
            detail = httpException.getDetail();
        } else {
            log.error("Request handler fails to execute (resource: {})", context.getUrl(), error);
            status = 500;
            detail = "Request handler fails to execute.";
        }
        if (context.getSink().isCommitted()) {
            log.debug("Response already written for {}, dropping {} error", context.getUrl(), status);
            return;
        }
        responder.error(context.getSink(), status, detail);
    }

    private static <T> CompletableFuture<T> call(Stage<T> stage) {
        try {
            CompletionStage<T> result = stage.start();
            return result != null ? result.toCompletableFuture() : CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @FunctionalInterface
    private interface Stage<T> {

        CompletionStage<T> start() throws Exception;

    }

}
