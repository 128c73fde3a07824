package com.glengine.posting;

import lombok.Value;

import java.util.List;

@Value
public class LineValidation {
    boolean valid;
    List<String> errors;
}
