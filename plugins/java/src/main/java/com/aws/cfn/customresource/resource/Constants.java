package com.aws.cfn.customresource.resource;

public class Constants {

    public final static String PHYSICAL_RESOURCE_ID_PREFIX = "arn:custom:cfn-resource-provider:::";
    public final static char STACK_ID_SEPARATOR = '/';
    public final static String SUFFIX_SEPARATOR = "/";
}
