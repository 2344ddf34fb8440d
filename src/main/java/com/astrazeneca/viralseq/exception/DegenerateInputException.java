package com.astrazeneca.viralseq.exception;


import java.util.Locale;

public class DegenerateInputException extends RuntimeException {
    public final static String DegenerateInputExceptionMessage = "%s is undefined for the collection \"%s\": %s.";

    public DegenerateInputException(String statistic, String title, String reason) {
            super(String.format(Locale.US, DegenerateInputExceptionMessage, statistic, title, reason));
    }
}
