package com.astrazeneca.viralseq.exception;


import java.util.Locale;

public class SequenceInputException extends RuntimeException {
    public final static String SequenceInputExceptionMessage = "The sequence file \"%s\" can't be read: %s. " +
            "Please check that the path is correct and the file is in FASTA or FASTQ format.";

    public SequenceInputException(String file, String reason) {
            super(String.format(Locale.US, SequenceInputExceptionMessage, file, reason));
    }

    public SequenceInputException(String file, Throwable e) {
            super(String.format(Locale.US, SequenceInputExceptionMessage, file, e.getMessage()), e);
    }
}
