package com.glengine.posting;

import lombok.Value;

import java.util.List;

/**
 * Allocations checked against outstanding document balances.
 * Errors block the payment; warnings are advisory.
 */
@Value
public class AllocationCheck {
    boolean valid;
    List<String> errors;
    List<String> warnings;
}
