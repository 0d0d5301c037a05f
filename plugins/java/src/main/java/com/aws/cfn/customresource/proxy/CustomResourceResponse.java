package com.aws.cfn.customresource.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The response CloudFormation expects at the response URL of a {@link CustomResourceRequest}. Only
 * obtainable from a request (see {@link RequestSnapshot}) so the identity fields are always the ones
 * CloudFormation sent.
 *
 * See https://docs.aws.amazon.com/AWSCloudFormation/latest/UserGuide/crpg-ref-responses.html
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class CustomResourceResponse {
    static final String STATUS = "Status";
    static final String REASON = "Reason";
    static final String REQUEST_ID = "RequestId";
    static final String LOGICAL_RESOURCE_ID = "LogicalResourceId";
    static final String STACK_ID = "StackId";
    static final String PHYSICAL_RESOURCE_ID = "PhysicalResourceId";
    static final String NO_ECHO = "NoEcho";
    static final String DATA = "Data";

    /**
     * Copied verbatim from the request
     */
    @JsonProperty(REQUEST_ID)
    private final String requestId;

    /**
     * Copied verbatim from the request
     */
    @JsonProperty(LOGICAL_RESOURCE_ID)
    private final String logicalResourceId;

    /**
     * Copied verbatim from the request
     */
    @JsonProperty(STACK_ID)
    private final String stackId;

    /**
     * Must be non-empty and identical for all responses for the same resource, up to 1 KB
     */
    @JsonProperty(PHYSICAL_RESOURCE_ID)
    private final String physicalResourceId;

    CustomResourceResponse(final String requestId,
                           final String logicalResourceId,
                           final String stackId,
                           final String physicalResourceId) {
        this.requestId = requestId;
        this.logicalResourceId = logicalResourceId;
        this.stackId = stackId;
        this.physicalResourceId = physicalResourceId;
    }

    @JsonProperty(STATUS)
    public abstract ResponseStatus getStatus();
}
