package com.invoiceflow.poster.erp;

public class ErpInterruptedException extends RuntimeException {

    public ErpInterruptedException(InterruptedException cause) {
        super("Interrupted during ERP retry backoff", cause);
    }
}
