package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Sent when the template developer deletes the stack or removes the custom resource from it; the
 * stack can only be deleted once this request is answered successfully
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DeleteRequest<P extends PhysicalResourceIdSuffixProvider> extends CustomResourceRequest<P> {

    private final String physicalResourceId;

    public DeleteRequest(final String requestId,
                         final String responseUrl,
                         final String resourceType,
                         final String logicalResourceId,
                         final String stackId,
                         final String physicalResourceId,
                         final P resourceProperties) {
        super(requestId, responseUrl, resourceType, logicalResourceId, stackId, resourceProperties);
        this.physicalResourceId = physicalResourceId;
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.Delete;
    }

    @Override
    public String getPhysicalResourceId() {
        return this.physicalResourceId;
    }
}
