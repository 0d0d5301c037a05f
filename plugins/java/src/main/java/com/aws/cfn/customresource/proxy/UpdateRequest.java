package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Sent when any property of the custom resource changes within the template
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class UpdateRequest<P extends PhysicalResourceIdSuffixProvider> extends CustomResourceRequest<P> {

    /**
     * The physical resource ID returned by the previous response for this resource
     */
    private final String oldPhysicalResourceId;

    /**
     * The resource properties as they were declared before this update
     */
    private final P oldResourceProperties;

    public UpdateRequest(final String requestId,
                         final String responseUrl,
                         final String resourceType,
                         final String logicalResourceId,
                         final String stackId,
                         final String oldPhysicalResourceId,
                         final P resourceProperties,
                         final P oldResourceProperties) {
        super(requestId, responseUrl, resourceType, logicalResourceId, stackId, resourceProperties);
        this.oldPhysicalResourceId = oldPhysicalResourceId;
        this.oldResourceProperties = oldResourceProperties;
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.Update;
    }

    @Override
    public String getPhysicalResourceId() {
        return generatePhysicalResourceId();
    }

    /**
     * CloudFormation treats a changed physical resource ID as a replacement and sends a Delete for the
     * old one once the stack update completes
     * @return true if the ID reported for this update differs from the previous one
     */
    public boolean isReplacement() {
        return !getPhysicalResourceId().equals(this.oldPhysicalResourceId);
    }
}
