package com.aws.cfn.customresource.exceptions;

/**
 * The response could not be serialized; delivery to CloudFormation was skipped
 */
public class EncodeException extends RuntimeException {

    private static final long serialVersionUID = -7165400218850731862L;

    public EncodeException(final String message,
                           final Throwable cause) {
        super(message, cause);
    }
}
