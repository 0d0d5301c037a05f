package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.resource.PhysicalResourceIdSuffixProvider;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * The provisioning logic of a custom resource. A stage completing with a value reports SUCCESS, with
 * the value (if any) as the response Data; a stage completing exceptionally reports FAILED with the
 * exception message as the reason.
 *
 * @param <P> Type of the resource properties
 * @param <S> Type of the data returned to the template through Fn::GetAtt
 */
@FunctionalInterface
public interface CustomResourceHandler<P extends PhysicalResourceIdSuffixProvider, S> {

    CompletionStage<Optional<S>> handleRequest(CustomResourceRequest<P> request);
}
