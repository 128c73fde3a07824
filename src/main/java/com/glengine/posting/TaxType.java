package com.glengine.posting;

public enum TaxType {
    INPUT,
    OUTPUT,
    EXEMPT
}
