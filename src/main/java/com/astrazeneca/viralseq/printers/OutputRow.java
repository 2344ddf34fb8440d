package com.astrazeneca.viralseq.printers;

/**
 * Abstract class for rows of tabular output. Inherited classes contain the fields of their row and print them
 * joined by delimiter in toString().
 */
public abstract class OutputRow {
    protected String delimiter = "\t";

    /**
     * Set delimiter to print fields. Default is <code>\t</code> (tab delimiter).
     * @param delimiter string contains delimiter
     */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }
}
