package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Sent when the template developer creates a stack that contains the custom resource
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class CreateRequest<P extends PhysicalResourceIdSuffixProvider> extends CustomResourceRequest<P> {

    public CreateRequest(final String requestId,
                         final String responseUrl,
                         final String resourceType,
                         final String logicalResourceId,
                         final String stackId,
                         final P resourceProperties) {
        super(requestId, responseUrl, resourceType, logicalResourceId, stackId, resourceProperties);
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.Create;
    }

    @Override
    public String getPhysicalResourceId() {
        return generatePhysicalResourceId();
    }
}
