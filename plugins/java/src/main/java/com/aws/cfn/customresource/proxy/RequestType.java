package com.aws.cfn.customresource.proxy;

import com.aws.cfn.customresource.exceptions.DecodeException;

/**
 * The lifecycle operation CloudFormation requests, sent as the RequestType field
 */
public enum RequestType {
    Create,
    Update,
    Delete;

    public static RequestType fromValue(final String value) {
        if (value == null) {
            throw new DecodeException("Missing RequestType");
        }

        for (final RequestType requestType : values()) {
            if (requestType.name().equals(value)) {
                return requestType;
            }
        }

        throw new DecodeException(String.format("Unknown RequestType '%s'", value));
    }
}
