package com.aws.cfn.customresource.proxy;

public enum ResponseStatus {
    SUCCESS,
    FAILED
}
