package com.routerline.backend.batch;

import java.util.List;
import java.util.Objects;

public record RuleMove(String from, String to, List<RuleField> fields) {

    public RuleMove {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        fields = (fields == null) ? List.of() : List.copyOf(fields);
    }
}
