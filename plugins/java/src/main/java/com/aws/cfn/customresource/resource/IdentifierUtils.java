package com.aws.cfn.customresource.resource;

import org.apache.commons.lang3.StringUtils;

public class IdentifierUtils {

    /**
     * Generates the physical resource ID for a Create or Update request, of the form
     * {@code arn:custom:cfn-resource-provider:::{stackSegment}-{logicalResourceId}[/{suffix}]}
     *
     * @param stackId           the stack ARN; only the segment after the last '/' (the stack GUID) is used,
     *                          or the whole value if it contains no '/'
     * @param logicalResourceId the template-chosen name of the resource
     * @param suffix            the value of {@link PhysicalResourceIdSuffixProvider#physicalResourceIdSuffix()};
     *                          null or empty appends nothing
     * @return generated ID string
     */
    public static String generatePhysicalResourceId(final String stackId,
                                                    final String logicalResourceId,
                                                    final String suffix) {
        final StringBuilder sb = new StringBuilder(Constants.PHYSICAL_RESOURCE_ID_PREFIX)
            .append(stackSegment(stackId))
            .append("-")
            .append(logicalResourceId);

        if (StringUtils.isNotEmpty(suffix)) {
            sb.append(Constants.SUFFIX_SEPARATOR).append(suffix);
        }

        return sb.toString();
    }

    /**
     * Stack IDs look like arn:aws:cloudformation:region:account:stack/stack-name/guid; non-standard IDs
     * without a separator are used as they are.
     */
    static String stackSegment(final String stackId) {
        return stackId.substring(stackId.lastIndexOf(Constants.STACK_ID_SEPARATOR) + 1);
    }
}
