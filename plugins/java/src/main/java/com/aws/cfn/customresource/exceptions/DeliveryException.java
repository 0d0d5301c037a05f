package com.aws.cfn.customresource.exceptions;

import lombok.Getter;

/**
 * Sending the response to the response URL failed, either in transport or with a non-2xx status
 */
public class DeliveryException extends RuntimeException {

    private static final long serialVersionUID = 2935460121587385129L;

    /**
     * The HTTP status returned for the PUT, or -1 if no response was received
     */
    @Getter
    private final int statusCode;

    public DeliveryException(final int statusCode) {
        super(String.format("Response delivery failed with HTTP status %d", statusCode));
        this.statusCode = statusCode;
    }

    public DeliveryException(final String message,
                             final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }
}
