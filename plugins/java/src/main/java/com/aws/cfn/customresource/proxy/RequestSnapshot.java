package com.aws.cfn.customresource.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The part of a request a response is derived from, taken before the handler gets hold of the request.
 * It keeps no reference to the resource properties, so whatever the handler does to them cannot change
 * the physical resource ID reported back to CloudFormation.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RequestSnapshot {

    private final String requestId;
    private final String logicalResourceId;
    private final String stackId;
    private final String physicalResourceId;

    RequestSnapshot(final String requestId,
                    final String logicalResourceId,
                    final String stackId,
                    final String physicalResourceId) {
        this.requestId = requestId;
        this.logicalResourceId = logicalResourceId;
        this.stackId = stackId;
        this.physicalResourceId = physicalResourceId;
    }

    /**
     * @param data values made available to Fn::GetAtt, or null to omit the Data field
     */
    public SuccessResponse toSuccessResponse(final JsonNode data) {
        return new SuccessResponse(
            this.requestId,
            this.logicalResourceId,
            this.stackId,
            this.physicalResourceId,
            data);
    }

    public FailedResponse toFailedResponse(final String reason) {
        return new FailedResponse(
            reason,
            this.requestId,
            this.logicalResourceId,
            this.stackId,
            this.physicalResourceId);
    }
}
