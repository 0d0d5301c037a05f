package com.aws.cfn.customresource.resource;

/**
 * Implemented by the type holding the custom resource properties. The returned suffix is appended to
 * the physical resource ID generated for Create and Update requests:
 *
 * <pre>
 * arn:custom:cfn-resource-provider:::{stack-guid}-{logicalResourceId}/{suffix}
 * </pre>
 *
 * The suffix should be built from exactly those properties which force the handler to create a new
 * physical resource, so that an Update touching only other properties keeps the same ID while a
 * substantive change mints a new one (which CloudFormation treats as a replacement).
 * It is a good idea to include the resource kind and a version in it, for example
 * {@code "bucket@1.0/" + bucketName}.
 *
 * The default implementation returns the empty string, in which case no separator is appended.
 */
public interface PhysicalResourceIdSuffixProvider {

    default String physicalResourceIdSuffix() {
        return "";
    }
}
