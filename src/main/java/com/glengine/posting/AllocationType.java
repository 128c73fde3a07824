package com.glengine.posting;

/**
 * What a payment allocation settles: a supplier bill (outgoing) or a customer invoice (incoming).
 */
public enum AllocationType {
    BILL,
    INVOICE
}
