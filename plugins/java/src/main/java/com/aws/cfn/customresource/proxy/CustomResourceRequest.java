package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.resource.IdentifierUtils;
import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A custom resource request sent by CloudFormation on stack modification. Exactly one of
 * {@link CreateRequest}, {@link UpdateRequest} or {@link DeleteRequest}; the fields shared by all
 * three are accessible here without inspecting the variant.
 *
 * See https://docs.aws.amazon.com/AWSCloudFormation/latest/UserGuide/crpg-ref-requests.html
 *
 * @param <P> Type of the resource properties, which also decides how the physical resource ID is suffixed
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class CustomResourceRequest<P extends PhysicalResourceIdSuffixProvider> {

    /**
     * A unique ID for the request
     */
    private final String requestId;

    /**
     * The presigned S3 URL which receives the response; it grants write access, so it is kept out of toString()
     */
    @ToString.Exclude
    private final String responseUrl;

    /**
     * The template developer-chosen resource type, e.g. Custom::MyResource
     */
    private final String resourceType;

    /**
     * The template developer-chosen name (logical ID) of the custom resource
     */
    private final String logicalResourceId;

    /**
     * The ARN of the stack containing the custom resource
     */
    private final String stackId;

    /**
     * The contents of the Properties object sent by the template developer
     */
    private final P resourceProperties;

    CustomResourceRequest(final String requestId,
                          final String responseUrl,
                          final String resourceType,
                          final String logicalResourceId,
                          final String stackId,
                          final P resourceProperties) {
        this.requestId = requestId;
        this.responseUrl = responseUrl;
        this.resourceType = resourceType;
        this.logicalResourceId = logicalResourceId;
        this.stackId = stackId;
        this.resourceProperties = resourceProperties;
    }

    public abstract RequestType getRequestType();

    /**
     * The physical resource ID to report for this request: generated from the stack, logical ID and
     * properties suffix for Create and Update, the supplied one for Delete
     */
    public abstract String getPhysicalResourceId();

    /**
     * Captures the identity fields a response is built from, with the physical resource ID resolved now
     */
    public RequestSnapshot snapshot() {
        return new RequestSnapshot(
            this.requestId,
            this.logicalResourceId,
            this.stackId,
            getPhysicalResourceId());
    }

    public SuccessResponse toSuccessResponse(final JsonNode data) {
        return snapshot().toSuccessResponse(data);
    }

    public FailedResponse toFailedResponse(final String reason) {
        return snapshot().toFailedResponse(reason);
    }

    String generatePhysicalResourceId() {
        final String suffix = this.resourceProperties == null
            ? ""
            : this.resourceProperties.physicalResourceIdSuffix();

        return IdentifierUtils.generatePhysicalResourceId(this.stackId, this.logicalResourceId, suffix);
    }
}
