package com.aws.cfn.customresource;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.aws.cfn.customresource.exceptions.EncodeException;
import com.aws.cfn.customresource.proxy.CustomResourceHandler;
import com.aws.cfn.customresource.proxy.CustomResourceRequest;
import com.aws.cfn.customresource.proxy.CustomResourceResponse;
import com.aws.cfn.customresource.proxy.RequestSnapshot;
import com.aws.cfn.customresource.proxy.ResponseSender;
import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import com.aws.cfn.customresource.resource.Serializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import lombok.Setter;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Runs a {@link CustomResourceHandler} for one request and reports its outcome to CloudFormation.
 *
 * The returned future resolves to the handler's own outcome once the response has been delivered.
 * If the response could not be serialized or delivered, it fails with that
 * {@link EncodeException} or {@link com.aws.cfn.customresource.exceptions.DeliveryException} instead,
 * even when the handler itself failed; the handler's failure is then only visible in the Reason of the
 * FAILED response that was sent. Nothing is retried.
 */
public class CustomResourceProcessor {

    private final ResponseSender responseSender;
    private final Serializer serializer;

    @Setter
    private LambdaLogger logger;

    /**
     * This .ctor provided for Lambda runtime which will not automatically invoke Guice injector
     */
    public CustomResourceProcessor() {
        final Injector injector = Guice.createInjector(new LambdaModule());
        this.responseSender = injector.getInstance(ResponseSender.class);
        this.serializer = injector.getInstance(Serializer.class);
    }

    /**
     * This .ctor provided for testing
     */
    @Inject
    public CustomResourceProcessor(final ResponseSender responseSender,
                                   final Serializer serializer) {
        this.responseSender = responseSender;
        this.serializer = serializer;
    }

    public <P extends PhysicalResourceIdSuffixProvider, S> CompletableFuture<Optional<S>> process(
        final CustomResourceHandler<P, S> handler,
        final CustomResourceRequest<P> request) {

        final String responseUrl = request.getResponseUrl();
        final RequestSnapshot snapshot;
        try {
            snapshot = request.snapshot();
        } catch (final RuntimeException e) {
            // without a physical resource ID there is nothing to report
            this.log(String.format("Physical resource ID could not be derived: %s", e));
            return failed(e);
        }

        this.log(String.format("Invoking handler for %s request %s (%s)",
            request.getRequestType(),
            request.getRequestId(),
            request.getLogicalResourceId()));

        return invokeHandler(handler, request)
            .handle(HandlerOutcome<S>::new)
            .thenCompose(outcome -> respond(snapshot, responseUrl, outcome));
    }

    private <S> CompletableFuture<Optional<S>> respond(final RequestSnapshot snapshot,
                                                      final String responseUrl,
                                                      final HandlerOutcome<S> outcome) {
        final String body;
        try {
            body = this.serializer.serialize(createResponse(snapshot, outcome));
        } catch (final EncodeException e) {
            this.log(String.format("Response could not be serialized: %s", e.getMessage()));
            return failed(e);
        } catch (final JsonProcessingException e) {
            this.log(String.format("Response could not be serialized: %s", e.getMessage()));
            return failed(new EncodeException("Response could not be serialized", e));
        }

        return this.responseSender.send(responseUrl, body)
            .toCompletableFuture()
            .handle((ignored, deliveryError) -> {
                if (deliveryError != null) {
                    final Throwable cause = unwrap(deliveryError);
                    this.log(String.format("Response delivery failed: %s", cause.getMessage()));
                    return CustomResourceProcessor.<Optional<S>>failed(cause);
                }

                this.log(String.format("Response %s delivered", outcome.error == null ? "SUCCESS" : "FAILED"));
                return outcome.toFuture();
            })
            .thenCompose(resolved -> resolved);
    }

    private <P extends PhysicalResourceIdSuffixProvider, S> CompletableFuture<Optional<S>> invokeHandler(
        final CustomResourceHandler<P, S> handler,
        final CustomResourceRequest<P> request) {

        final CompletionStage<Optional<S>> stage;
        try {
            stage = handler.handleRequest(request);
        } catch (final RuntimeException e) {
            return failed(e);
        }

        if (stage == null) {
            return failed(new IllegalStateException("Handler failed to provide a response."));
        }

        return stage.toCompletableFuture();
    }

    private CustomResourceResponse createResponse(final RequestSnapshot snapshot,
                                                  final HandlerOutcome<?> outcome) {
        if (outcome.error != null) {
            this.log(String.format("Handler failed: %s", outcome.error));
            return snapshot.toFailedResponse(reason(outcome.error));
        }

        JsonNode data = null;
        if (outcome.value != null && outcome.value.isPresent()) {
            try {
                data = this.serializer.toTree(outcome.value.get());
            } catch (final IllegalArgumentException e) {
                throw new EncodeException("Handler result could not be serialized", e);
            }
        }

        return snapshot.toSuccessResponse(data);
    }

    static String reason(final Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }

    static Throwable unwrap(final Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static <T> CompletableFuture<T> failed(final Throwable error) {
        final CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    /**
     * null-safe logger redirect
     * @param message A string containing the event to log.
     */
    private void log(final String message) {
        if (this.logger != null) {
            this.logger.log(String.format("%s%n", message));
        }
    }

    private static final class HandlerOutcome<S> {
        private final Optional<S> value;
        private final Throwable error;

        private HandlerOutcome(final Optional<S> value,
                               final Throwable error) {
            this.value = value;
            this.error = error == null ? null : unwrap(error);
        }

        private CompletableFuture<Optional<S>> toFuture() {
            if (this.error != null) {
                return failed(this.error);
            }
            return CompletableFuture.completedFuture(this.value == null ? Optional.empty() : this.value);
        }
    }
}
