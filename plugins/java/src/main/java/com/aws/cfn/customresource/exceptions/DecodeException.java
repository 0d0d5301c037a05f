package com.aws.cfn.customresource.exceptions;

/**
 * The inbound request could not be decoded; nothing has been reported to CloudFormation
 */
public class DecodeException extends RuntimeException {

    private static final long serialVersionUID = 5043816290584219917L;

    public DecodeException(final String message) {
        super(message);
    }

    public DecodeException(final String message,
                           final Throwable cause) {
        super(message, cause);
    }
}
