package com.aws.cfn.customresource.exceptions;

/**
 * Reports the final failure of an invocation to the Lambda runtime
 */
public class TerminalException extends RuntimeException {

    private static final long serialVersionUID = -1646136434112354328L;

    public TerminalException(final String customerFacingErrorMessage) {
        super(customerFacingErrorMessage);
    }

    public TerminalException(final String customerFacingErrorMessage,
                             final Throwable cause) {
        super(customerFacingErrorMessage, cause);
    }
}
