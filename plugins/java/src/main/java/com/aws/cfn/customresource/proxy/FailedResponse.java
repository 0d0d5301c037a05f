package com.aws.cfn.customresource.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonPropertyOrder({
    CustomResourceResponse.STATUS,
    CustomResourceResponse.REASON,
    CustomResourceResponse.REQUEST_ID,
    CustomResourceResponse.LOGICAL_RESOURCE_ID,
    CustomResourceResponse.STACK_ID,
    CustomResourceResponse.PHYSICAL_RESOURCE_ID
})
public final class FailedResponse extends CustomResourceResponse {

    /**
     * Describes the reason for the failure, shown in the stack events
     */
    @JsonProperty(REASON)
    private final String reason;

    FailedResponse(final String reason,
                   final String requestId,
                   final String logicalResourceId,
                   final String stackId,
                   final String physicalResourceId) {
        super(requestId, logicalResourceId, stackId, physicalResourceId);
        this.reason = reason;
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.FAILED;
    }
}
