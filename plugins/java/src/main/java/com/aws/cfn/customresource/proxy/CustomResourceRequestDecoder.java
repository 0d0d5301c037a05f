package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.exceptions.DecodeException;
import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import com.aws.cfn.customresource.resource.Serializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.inject.Inject;

import java.io.IOException;

/**
 * Decodes the JSON event CloudFormation sends for a custom resource into a {@link CustomResourceRequest}.
 * Unknown keys of the event itself are ignored; the resource properties must match the requested type.
 */
public class CustomResourceRequestDecoder {
    static final String REQUEST_TYPE = "RequestType";
    static final String REQUEST_ID = "RequestId";
    static final String RESPONSE_URL = "ResponseURL";
    static final String RESOURCE_TYPE = "ResourceType";
    static final String LOGICAL_RESOURCE_ID = "LogicalResourceId";
    static final String STACK_ID = "StackId";
    static final String PHYSICAL_RESOURCE_ID = "PhysicalResourceId";
    static final String RESOURCE_PROPERTIES = "ResourceProperties";
    static final String OLD_RESOURCE_PROPERTIES = "OldResourceProperties";

    private final ObjectMapper objectMapper;

    public CustomResourceRequestDecoder() {
        this(new Serializer());
    }

    @Inject
    public CustomResourceRequestDecoder(final Serializer serializer) {
        this.objectMapper = serializer.getObjectMapper();
    }

    public <P extends PhysicalResourceIdSuffixProvider> CustomResourceRequest<P> decode(final String input,
                                                                                       final Class<P> propertiesType) {
        return decode(input, this.objectMapper.constructType(propertiesType));
    }

    public <P extends PhysicalResourceIdSuffixProvider> CustomResourceRequest<P> decode(final String input,
                                                                                       final TypeReference<P> propertiesType) {
        return decode(input, this.objectMapper.constructType(propertiesType));
    }

    /**
     * @param input          the raw event
     * @param propertiesType the resource properties type, which must implement {@link PhysicalResourceIdSuffixProvider}
     * @throws DecodeException if the event is not valid JSON, the RequestType is missing or unknown, a
     *                         required field is missing, or the resource properties do not match the type
     */
    public <P extends PhysicalResourceIdSuffixProvider> CustomResourceRequest<P> decode(final String input,
                                                                                       final JavaType propertiesType) {
        final JsonNode event;
        try {
            event = this.objectMapper.readTree(input);
        } catch (final JsonProcessingException e) {
            throw new DecodeException("Request is not valid JSON", e);
        }

        if (event == null || !event.isObject()) {
            throw new DecodeException("Request must be a JSON object");
        }

        final RequestType requestType = RequestType.fromValue(optionalText(event, REQUEST_TYPE));

        final String requestId = requiredText(event, REQUEST_ID);
        final String responseUrl = requiredText(event, RESPONSE_URL);
        final String resourceType = requiredText(event, RESOURCE_TYPE);
        final String logicalResourceId = requiredText(event, LOGICAL_RESOURCE_ID);
        final String stackId = requiredText(event, STACK_ID);
        final P resourceProperties = properties(event, RESOURCE_PROPERTIES, propertiesType);

        switch (requestType) {
            case Create:
                return new CreateRequest<>(
                    requestId,
                    responseUrl,
                    resourceType,
                    logicalResourceId,
                    stackId,
                    resourceProperties);
            case Update:
                return new UpdateRequest<>(
                    requestId,
                    responseUrl,
                    resourceType,
                    logicalResourceId,
                    stackId,
                    requiredText(event, PHYSICAL_RESOURCE_ID),
                    resourceProperties,
                    properties(event, OLD_RESOURCE_PROPERTIES, propertiesType));
            case Delete:
                return new DeleteRequest<>(
                    requestId,
                    responseUrl,
                    resourceType,
                    logicalResourceId,
                    stackId,
                    requiredText(event, PHYSICAL_RESOURCE_ID),
                    resourceProperties);
            default:
                throw new DecodeException(String.format("Unsupported RequestType '%s'", requestType));
        }
    }

    private <P> P properties(final JsonNode event,
                             final String fieldName,
                             final JavaType propertiesType) {
        // absent and null are the same to the properties type; it decides whether either is acceptable
        final JsonNode node = event.hasNonNull(fieldName) ? event.get(fieldName) : NullNode.getInstance();

        final P properties;
        try {
            properties = this.objectMapper.readerFor(propertiesType).readValue(node);
        } catch (final IOException e) {
            throw new DecodeException(
                String.format("%s could not be decoded as %s: %s",
                    fieldName,
                    propertiesType.getRawClass().getSimpleName(),
                    e.getMessage()),
                e);
        }

        if (properties == null) {
            throw new DecodeException(String.format("Missing required field %s", fieldName));
        }

        return properties;
    }

    private static String requiredText(final JsonNode event,
                                       final String fieldName) {
        final String value = optionalText(event, fieldName);
        if (value == null) {
            throw new DecodeException(String.format("Missing required field %s", fieldName));
        }
        return value;
    }

    private static String optionalText(final JsonNode event,
                                       final String fieldName) {
        final JsonNode node = event.get(fieldName);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new DecodeException(String.format("Field %s must be a string", fieldName));
        }
        return node.textValue();
    }
}
