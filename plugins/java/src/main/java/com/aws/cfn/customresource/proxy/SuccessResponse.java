package com.aws.cfn.customresource.proxy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonPropertyOrder({
    CustomResourceResponse.STATUS,
    CustomResourceResponse.REQUEST_ID,
    CustomResourceResponse.LOGICAL_RESOURCE_ID,
    CustomResourceResponse.STACK_ID,
    CustomResourceResponse.PHYSICAL_RESOURCE_ID,
    CustomResourceResponse.NO_ECHO,
    CustomResourceResponse.DATA
})
public final class SuccessResponse extends CustomResourceResponse {

    /**
     * Masks the output of Fn::GetAtt when true. Never set by this library, so never sent.
     */
    @JsonProperty(NO_ECHO)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Boolean noEcho = null;

    /**
     * Name-value pairs accessible in the template with Fn::GetAtt
     */
    @JsonProperty(DATA)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final JsonNode data;

    SuccessResponse(final String requestId,
                    final String logicalResourceId,
                    final String stackId,
                    final String physicalResourceId,
                    final JsonNode data) {
        super(requestId, logicalResourceId, stackId, physicalResourceId);
        this.data = data;
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.SUCCESS;
    }
}
