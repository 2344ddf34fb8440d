package com.astrazeneca.viralseq.exception;


import java.util.Locale;

public class EmptyInputException extends RuntimeException {
    public final static String EmptyInputExceptionMessage = "The collection \"%s\" contains no sequences, " +
            "at least one sequence is required for %s.";

    public EmptyInputException(String title, String operation) {
            super(String.format(Locale.US, EmptyInputExceptionMessage, title, operation));
    }
}
