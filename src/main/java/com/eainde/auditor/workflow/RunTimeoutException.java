package com.eainde.auditor.workflow;

/**
 * The global run deadline passed while a stage barrier was still waiting.
 */
public class RunTimeoutException extends Exception {

    public RunTimeoutException(String message) {
        super(message);
    }
}
