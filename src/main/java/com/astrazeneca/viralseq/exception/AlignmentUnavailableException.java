package com.astrazeneca.viralseq.exception;


import java.util.Locale;

public class AlignmentUnavailableException extends RuntimeException {
    public final static String AlignmentUnavailableExceptionMessage = "Alignment with \"%s\" failed: %s. " +
            "Check that MUSCLE is installed and the path is set with the -muscle option.";

    public AlignmentUnavailableException(String aligner, String reason) {
            super(String.format(Locale.US, AlignmentUnavailableExceptionMessage, aligner, reason));
    }

    public AlignmentUnavailableException(String aligner, Throwable e) {
            super(String.format(Locale.US, AlignmentUnavailableExceptionMessage, aligner, e.getMessage()), e);
    }
}
