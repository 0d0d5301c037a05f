package com.aws.cfn.customresource;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.aws.cfn.customresource.exceptions.DeliveryException;
import com.aws.cfn.customresource.exceptions.EncodeException;
import com.aws.cfn.customresource.proxy.CreateRequest;
import com.aws.cfn.customresource.proxy.CustomResourceHandler;
import com.aws.cfn.customresource.proxy.DeleteRequest;
import com.aws.cfn.customresource.proxy.OkHttpResponseSender;
import com.aws.cfn.customresource.proxy.ResponseSender;
import com.aws.cfn.customresource.resource.IgnoredProperties;
import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import com.aws.cfn.customresource.resource.Serializer;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsEqual.equalTo;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CustomResourceProcessorTest {

    private static final String RESPONSE_URL = "pre-signed-url-for-create-response";
    private static final String STACK_ID = "arn:aws:cloudformation:us-east-2:namespace:stack/stack-name/guid";
    private static final String PHYSICAL_RESOURCE_ID =
        "arn:custom:cfn-resource-provider:::guid-name of resource in template";

    private final Serializer serializer = new Serializer();

    private ResponseSender getResponseSender(final CompletableFuture<Void> delivery) {
        final ResponseSender responseSender = mock(ResponseSender.class);
        when(responseSender.send(anyString(), anyString())).thenReturn(delivery);
        return responseSender;
    }

    private ResponseSender getDeliveringResponseSender() {
        return getResponseSender(CompletableFuture.completedFuture(null));
    }

    private ResponseSender getRejectingResponseSender(final int statusCode) {
        final CompletableFuture<Void> delivery = new CompletableFuture<>();
        delivery.completeExceptionally(new DeliveryException(statusCode));
        return getResponseSender(delivery);
    }

    private CreateRequest<IgnoredProperties> createRequest() {
        return new CreateRequest<>(
            "unique id for this create request",
            RESPONSE_URL,
            "Custom::MyCustomResourceType",
            "name of resource in template",
            STACK_ID,
            IgnoredProperties.INSTANCE);
    }

    private static <T> CompletableFuture<Optional<T>> failedWith(final Throwable error) {
        final CompletableFuture<Optional<T>> future = new CompletableFuture<>();
        future.completeExceptionally(error);
        return future;
    }

    private static Throwable awaitError(final CompletableFuture<?> future) throws Exception {
        try {
            future.get(10, TimeUnit.SECONDS);
        } catch (final ExecutionException e) {
            return e.getCause();
        }
        fail("Expected processing to fail");
        return null;
    }

    private JsonNode deliveredBody(final ResponseSender responseSender) throws IOException {
        final ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(responseSender, times(1)).send(eq(RESPONSE_URL), body.capture());
        return serializer.getObjectMapper().readTree(body.getValue());
    }

    @Test
    public void testProcess_SuccessWithoutData() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, String> handler =
            request -> CompletableFuture.completedFuture(Optional.empty());

        final Optional<String> result = processor.process(handler, createRequest()).get(10, TimeUnit.SECONDS);

        assertThat(result.isPresent(), is(false));

        final JsonNode body = deliveredBody(responseSender);
        assertThat(body.get("Status").asText(), is(equalTo("SUCCESS")));
        assertThat(body.get("RequestId").asText(), is(equalTo("unique id for this create request")));
        assertThat(body.get("PhysicalResourceId").asText(), is(equalTo(PHYSICAL_RESOURCE_ID)));
        assertThat(body.has("Data"), is(false));
        assertThat(body.has("Reason"), is(false));
    }

    @Test
    public void testProcess_SuccessWithData() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final TestModel output = new TestModel("value", true);
        final CustomResourceHandler<IgnoredProperties, TestModel> handler =
            request -> CompletableFuture.completedFuture(Optional.of(output));

        final Optional<TestModel> result = processor.process(handler, createRequest()).get(10, TimeUnit.SECONDS);

        assertThat(result.get(), is(sameInstance(output)));

        final JsonNode data = deliveredBody(responseSender).get("Data");
        assertThat(data.get("ExampleProperty1").asText(), is(equalTo("value")));
        assertThat(data.get("ExampleProperty2").asBoolean(), is(true));
    }

    @Test
    public void testProcess_SuccessButDeliveryRejected() throws Exception {
        final ResponseSender responseSender = getRejectingResponseSender(403);
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, String> handler =
            request -> CompletableFuture.completedFuture(Optional.empty());

        final Throwable error = awaitError(processor.process(handler, createRequest()));

        assertThat(error, is(instanceOf(DeliveryException.class)));
        assertThat(((DeliveryException) error).getStatusCode(), is(403));
    }

    @Test
    public void testProcess_HandlerErrorIsReportedAndReturned() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final RuntimeException boom = new RuntimeException("boom");
        final CustomResourceHandler<IgnoredProperties, String> handler = request -> failedWith(boom);

        final Throwable error = awaitError(processor.process(handler, createRequest()));

        assertThat(error, is(sameInstance(boom)));

        final JsonNode body = deliveredBody(responseSender);
        assertThat(body.get("Status").asText(), is(equalTo("FAILED")));
        assertThat(body.get("Reason").asText(), is(equalTo("boom")));
        assertThat(body.get("PhysicalResourceId").asText(), is(equalTo(PHYSICAL_RESOURCE_ID)));
        assertThat(body.has("Data"), is(false));
    }

    @Test
    public void testProcess_DeliveryErrorReplacesHandlerError() throws Exception {
        final ResponseSender responseSender = getRejectingResponseSender(403);
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, String> handler =
            request -> failedWith(new RuntimeException("boom"));

        final Throwable error = awaitError(processor.process(handler, createRequest()));

        assertThat(error, is(instanceOf(DeliveryException.class)));
        assertThat(deliveredBody(responseSender).get("Reason").asText(), is(equalTo("boom")));
    }

    @Test
    public void testProcess_HandlerThrowsSynchronously() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, String> handler = request -> {
            throw new IllegalArgumentException("bad input");
        };

        final Throwable error = awaitError(processor.process(handler, createRequest()));

        assertThat(error, is(instanceOf(IllegalArgumentException.class)));
        assertThat(deliveredBody(responseSender).get("Reason").asText(), is(equalTo("bad input")));
    }

    @Test
    public void testProcess_HandlerReturnsNullStage() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, String> handler = request -> null;

        final Throwable error = awaitError(processor.process(handler, createRequest()));

        assertThat(error.getMessage(), is(equalTo("Handler failed to provide a response.")));
        assertThat(
            deliveredBody(responseSender).get("Reason").asText(),
            is(equalTo("Handler failed to provide a response."))
        );
    }

    @Test
    public void testProcess_ErrorWithoutMessageStillHasReason() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, String> handler =
            request -> failedWith(new IllegalStateException());

        awaitError(processor.process(handler, createRequest()));

        assertThat(
            deliveredBody(responseSender).get("Reason").asText(),
            is(equalTo("java.lang.IllegalStateException"))
        );
    }

    @Test
    public void testProcess_UnserializableResultIsNotDelivered() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, BrokenOutput> handler =
            request -> CompletableFuture.completedFuture(Optional.of(new BrokenOutput()));

        final Throwable error = awaitError(processor.process(handler, createRequest()));

        assertThat(error, is(instanceOf(EncodeException.class)));
        verify(responseSender, never()).send(anyString(), anyString());
    }

    @Test
    public void testProcess_PhysicalResourceIdTakenBeforeHandlerRuns() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CreateRequest<TestModel> request = new CreateRequest<>(
            "id", RESPONSE_URL, "Custom::Type", "Logical", STACK_ID, new TestModel("before", null));
        final CustomResourceHandler<TestModel, String> handler = r -> {
            r.getResourceProperties().setExampleProperty1("after");
            return CompletableFuture.completedFuture(Optional.empty());
        };

        processor.process(handler, request).get(10, TimeUnit.SECONDS);

        assertThat(
            deliveredBody(responseSender).get("PhysicalResourceId").asText(),
            is(equalTo("arn:custom:cfn-resource-provider:::guid-Logical/before"))
        );
    }

    @Test
    public void testProcess_DeleteReportsSuppliedPhysicalResourceId() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final DeleteRequest<IgnoredProperties> request = new DeleteRequest<>(
            "id", RESPONSE_URL, "Custom::Type", "Logical", STACK_ID, "existing-id", IgnoredProperties.INSTANCE);
        final CustomResourceHandler<IgnoredProperties, String> handler =
            r -> CompletableFuture.completedFuture(Optional.empty());

        processor.process(handler, request).get(10, TimeUnit.SECONDS);

        assertThat(deliveredBody(responseSender).get("PhysicalResourceId").asText(), is(equalTo("existing-id")));
    }

    @Test
    public void testProcess_LogsWithoutResponseUrl() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final LambdaLogger logger = mock(LambdaLogger.class);
        processor.setLogger(logger);
        final CustomResourceHandler<IgnoredProperties, String> handler =
            request -> CompletableFuture.completedFuture(Optional.empty());

        processor.process(handler, createRequest()).get(10, TimeUnit.SECONDS);

        final ArgumentCaptor<String> messages = ArgumentCaptor.forClass(String.class);
        verify(logger, atLeastOnce()).log(messages.capture());
        for (final String message : messages.getAllValues()) {
            assertThat(message.contains(RESPONSE_URL), is(false));
        }
    }

    @Test
    public void testProcess_DeliversOverHttp() throws Exception {
        final MockWebServer server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200));
        server.start();
        try {
            final CustomResourceProcessor processor = new CustomResourceProcessor(new OkHttpResponseSender(), serializer);
            final CreateRequest<IgnoredProperties> request = new CreateRequest<>(
                "id", server.url("/response").toString(), "Custom::Type", "Logical", STACK_ID,
                IgnoredProperties.INSTANCE);
            final CustomResourceHandler<IgnoredProperties, String> handler =
                r -> failedWith(new RuntimeException("boom"));

            final Throwable error = awaitError(processor.process(handler, request));
            assertThat(error.getMessage(), is(equalTo("boom")));

            final RecordedRequest recorded = server.takeRequest(10, TimeUnit.SECONDS);
            assertThat(recorded.getMethod(), is(equalTo("PUT")));
            assertThat(
                recorded.getBody().readUtf8(),
                is(equalTo("{\"Status\":\"FAILED\",\"Reason\":\"boom\",\"RequestId\":\"id\","
                    + "\"LogicalResourceId\":\"Logical\",\"StackId\":\"" + STACK_ID + "\","
                    + "\"PhysicalResourceId\":\"arn:custom:cfn-resource-provider:::guid-Logical\"}"))
            );
        } finally {
            server.shutdown();
        }
    }

    @Test
    public void testProcess_ResultWithoutPropertiesIsEmptyData() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CustomResourceHandler<IgnoredProperties, EmptyOutput> handler =
            request -> CompletableFuture.completedFuture(Optional.of(new EmptyOutput()));

        final Optional<EmptyOutput> result = processor.process(handler, createRequest()).get(10, TimeUnit.SECONDS);

        assertThat(result.isPresent(), is(true));

        final JsonNode body = deliveredBody(responseSender);
        assertThat(body.get("Status").asText(), is(equalTo("SUCCESS")));
        assertThat(body.get("Data").isObject(), is(true));
        assertThat(body.get("Data").size(), is(0));
    }

    @Test
    public void testProcess_FailingSuffixIsReturnedAsFailedFuture() throws Exception {
        final ResponseSender responseSender = getDeliveringResponseSender();
        final CustomResourceProcessor processor = new CustomResourceProcessor(responseSender, serializer);
        final CreateRequest<FailingSuffix> request = new CreateRequest<>(
            "id", RESPONSE_URL, "Custom::Type", "Logical", STACK_ID, new FailingSuffix());
        final CustomResourceHandler<FailingSuffix, String> handler =
            r -> CompletableFuture.completedFuture(Optional.empty());

        final CompletableFuture<Optional<String>> future = processor.process(handler, request);
        final Throwable error = awaitError(future);

        assertThat(error, is(instanceOf(IllegalStateException.class)));
        assertThat(error.getMessage(), is(equalTo("suffix unavailable")));
        verify(responseSender, never()).send(anyString(), anyString());
    }

    /**
     * Handler output without any properties
     */
    public static class EmptyOutput {
    }

    /**
     * Resource properties whose suffix cannot be computed
     */
    public static class FailingSuffix implements PhysicalResourceIdSuffixProvider {
        @Override
        public String physicalResourceIdSuffix() {
            throw new IllegalStateException("suffix unavailable");
        }
    }

    /**
     * Handler output whose serialization always fails
     */
    public static class BrokenOutput {
        public String getValue() {
            throw new IllegalStateException("cannot read value");
        }
    }
}
