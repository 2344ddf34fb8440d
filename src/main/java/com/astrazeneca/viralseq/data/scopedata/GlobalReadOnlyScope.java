package com.astrazeneca.viralseq.data.scopedata;

import com.astrazeneca.viralseq.Configuration;
import com.astrazeneca.viralseq.printers.PrinterType;

/**
 * Global scope of ViralSeq. Contains configuration that must be available from all the modes and printers.
 * Must be initialized only once. Clear method created only for testing purposes.
 */
public class GlobalReadOnlyScope {

    private volatile static GlobalReadOnlyScope instance;

    public static GlobalReadOnlyScope instance() {
        return instance;
    }

    public static synchronized void init(Configuration conf) {
        if (instance != null) {
            throw new IllegalStateException("GlobalReadOnlyScope was already initialized. Must be initialized only once.");
        }
        instance = new GlobalReadOnlyScope(conf);
    }

    /**
     * TEST usage only
     */
    public static synchronized void clear(){
        instance = null;
    }

    public final Configuration conf;
    public final PrinterType printerTypeOut;

    public GlobalReadOnlyScope(Configuration conf) {
        this.conf = conf;
        this.printerTypeOut = conf.printerType;
    }
}
