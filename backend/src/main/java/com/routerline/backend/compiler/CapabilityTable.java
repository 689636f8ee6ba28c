package com.routerline.backend.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

public final class CapabilityTable {

    private record Row(String flag, String description, Predicate<VersionTag> supported) {}

    private final List<Row> rows = new ArrayList<>();

    public CapabilityTable always(String flag, String description) {
        rows.add(new Row(flag, description, v -> true));
        return this;
    }

    public CapabilityTable since(VersionTag first, String flag, String description) {
        rows.add(new Row(flag, description, v -> v.atLeast(first)));
        return this;
    }

    public CapabilityTable only(VersionTag tag, String flag, String description) {
        rows.add(new Row(flag, description, v -> v == tag));
        return this;
    }

    CapabilityMatrix evaluate(FeatureFamily family, VersionTag version) {
        Map<String, Capability> out = new LinkedHashMap<>();
        for (Row r : rows) out.put(r.flag(), new Capability(r.supported().test(version), r.description()));
        return new CapabilityMatrix(family, version, out);
    }
}
