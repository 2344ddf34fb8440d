package com.astrazeneca.viralseq.printers;

import com.astrazeneca.viralseq.data.LocatorResult;
import com.astrazeneca.viralseq.data.ReferenceGenome;

import static com.astrazeneca.viralseq.Utils.getRoundedValueToPrint;
import static com.astrazeneca.viralseq.Utils.join;

/**
 * Row of the sequence locator report. Printed as CSV by default.
 */
public class LocatorOutput extends OutputRow {
    private static final String[] HEADER = {"title", "sequence_identifier", "reference_id", "direction",
            "start", "end", "percent_similarity", "contains_indel", "aligned_query", "aligned_reference"};

    private final String title;
    private final String name;
    private final ReferenceGenome reference;
    private final LocatorResult result;

    public LocatorOutput(String title, String name, ReferenceGenome reference, LocatorResult result) {
        this.delimiter = ",";
        this.title = title;
        this.name = name;
        this.reference = reference;
        this.result = result;
    }

    public static String header(String delimiter) {
        return join(delimiter, (Object[]) HEADER);
    }

    @Override
    public String toString() {
        return join(delimiter,
                title,
                name,
                reference.name(),
                result.direction.getSymbol(),
                result.start,
                result.end,
                getRoundedValueToPrint("0.00", result.similarity),
                result.indel,
                result.alignedQuery,
                result.alignedReference
        );
    }
}
