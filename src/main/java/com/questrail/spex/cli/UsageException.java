package com.questrail.spex.cli;

/**
 * Invalid command line; maps to exit code 2.
 */
final class UsageException extends RuntimeException
{
    UsageException(String message) {
        super(message);
    }
}
