package com.aws.cfn.customresource;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.aws.cfn.customresource.exceptions.TerminalException;
import com.aws.cfn.customresource.proxy.CustomResourceHandler;
import com.aws.cfn.customresource.proxy.CustomResourceRequest;
import com.aws.cfn.customresource.proxy.CustomResourceRequestDecoder;
import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import com.aws.cfn.customresource.resource.Serializer;
import com.fasterxml.jackson.databind.JavaType;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Entry point for a custom resource provider hosted on AWS Lambda. Subclasses supply the resource
 * properties type and the provisioning logic; the wrapper decodes the CloudFormation event, runs the
 * logic, reports the outcome to CloudFormation and hands the result to the Lambda runtime.
 *
 * @param <P> Type of the resource properties
 * @param <S> Type of the data returned to the template through Fn::GetAtt
 */
public abstract class LambdaWrapper<P extends PhysicalResourceIdSuffixProvider, S>
    implements RequestStreamHandler, CustomResourceHandler<P, S> {

    private final CustomResourceProcessor processor;
    private final CustomResourceRequestDecoder decoder;
    private final Serializer serializer;
    private LambdaLogger logger;

    /**
     * This .ctor provided for Lambda runtime which will not automatically invoke Guice injector
     */
    public LambdaWrapper() {
        final Injector injector = Guice.createInjector(new LambdaModule());
        this.processor = injector.getInstance(CustomResourceProcessor.class);
        this.decoder = injector.getInstance(CustomResourceRequestDecoder.class);
        this.serializer = injector.getInstance(Serializer.class);
    }

    /**
     * This .ctor provided for testing
     */
    @Inject
    public LambdaWrapper(final CustomResourceProcessor processor,
                         final CustomResourceRequestDecoder decoder,
                         final Serializer serializer) {
        this.processor = processor;
        this.decoder = decoder;
        this.serializer = serializer;
    }

    @Override
    public void handleRequest(final InputStream inputStream,
                              final OutputStream outputStream,
                              final Context context) throws IOException, TerminalException {
        this.logger = context.getLogger();
        this.processor.setLogger(context.getLogger());

        if (inputStream == null) {
            throw new TerminalException("No request object received");
        }

        final Optional<S> result;
        try {
            final String input = IOUtils.toString(inputStream, StandardCharsets.UTF_8);
            final CustomResourceRequest<P> request = this.decoder.decode(input, provideResourcePropertiesType());

            result = this.processor.process(this, request).join();
        } catch (final RuntimeException e) {
            final Throwable cause = CustomResourceProcessor.unwrap(e);
            this.log(String.format("Invocation failed: %s", cause));
            throw new TerminalException(CustomResourceProcessor.reason(cause), cause);
        }

        try {
            outputStream.write(this.serializer.serialize(result.orElse(null)).getBytes(StandardCharsets.UTF_8));
        } finally {
            outputStream.close();
        }
    }

    /**
     * Handler implementation should implement this method to provide the type the ResourceProperties
     * (and OldResourceProperties) of the event are decoded to, e.g.
     * {@code TypeFactory.defaultInstance().constructType(MyProperties.class)} or
     * {@code OptionalProperties.typeOf(MyProperties.class)}
     * @return the resource properties type
     */
    protected abstract JavaType provideResourcePropertiesType();

    /**
     * null-safe logger redirect
     * @param message A string containing the event to log.
     */
    protected void log(final String message) {
        if (this.logger != null) {
            this.logger.log(String.format("%s%n", message));
        }
    }
}
