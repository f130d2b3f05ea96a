package com.costsentinel.core.config;

import java.util.List;

final class Validation {

    private Validation() {
    }

    static void requireUnit(List<String> errors, String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            errors.add(name + " must be in [0, 1], got: " + value);
        }
    }
}
