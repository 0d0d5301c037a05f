package com.aws.cfn.customresource.proxy;

import java.util.concurrent.CompletionStage;

/**
 * Interface used to abstract the delivery of a custom resource response to CloudFormation
 */
public interface ResponseSender {

    /**
     * Delivers the serialized response, exactly once and without retries
     * @param responseUrl the presigned ResponseURL of the request
     * @param body        the serialized {@link CustomResourceResponse}
     * @return a stage completing when CloudFormation accepted the response, or exceptionally with a
     *         {@link com.aws.cfn.customresource.exceptions.DeliveryException}
     */
    CompletionStage<Void> send(String responseUrl,
                               String body);
}
