package com.routerline.backend.compiler;

import com.routerline.backend.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One named operation of a feature grammar: where it lands in the tree, how it is deleted,
 * and whether it exists at all for a given firmware.
 */
public record OperationSpec(
        String name,
        LeafKind kind,
        List<PathTemplate> setTemplates,
        List<PathTemplate> deleteTemplates,
        Availability availability,
        String reason,
        Map<String, Set<String>> allowedValues
) {

    public enum Availability {
        AVAILABLE,
        ABSENT,       // field does not exist at this version, callers skip it
        UNSUPPORTED   // whole feature missing, callers get a CapabilityException
    }

    public OperationSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(availability, "availability");
        setTemplates = List.copyOf(setTemplates);
        deleteTemplates = List.copyOf(deleteTemplates);
        allowedValues = Map.copyOf(allowedValues);
        if (setTemplates.isEmpty()) throw new IllegalArgumentException(name + ": no set template");

        boolean valued = kind == LeafKind.LEAF || kind == LeafKind.MULTI;
        if (valued && (setTemplates.size() != 1 || !setTemplates.get(0).endsWithValue())) {
            throw new IllegalArgumentException(name + ": " + kind + " template must end with {value}");
        }
        if ((kind == LeafKind.NODE || kind == LeafKind.PRESENCE) && setTemplates.get(0).endsWithValue()) {
            throw new IllegalArgumentException(name + ": " + kind + " template must not end with {value}");
        }
    }

    public static OperationSpec of(String name, LeafKind kind, String template) {
        if (kind == LeafKind.COMPOUND) throw new IllegalArgumentException(name + ": use compound()");
        PathTemplate t = PathTemplate.parse(template);
        PathTemplate del = (kind == LeafKind.LEAF) ? t.withoutTrailingValue() : t;
        return new OperationSpec(name, kind, List.of(t), List.of(del), Availability.AVAILABLE, null, Map.of());
    }

    public static OperationSpec compound(String name, List<String> setTemplates, List<String> deleteTemplates) {
        return new OperationSpec(
                name,
                LeafKind.COMPOUND,
                setTemplates.stream().map(PathTemplate::parse).toList(),
                deleteTemplates.stream().map(PathTemplate::parse).toList(),
                Availability.AVAILABLE,
                null,
                Map.of()
        );
    }

    public OperationSpec absent() {
        return new OperationSpec(name, kind, setTemplates, deleteTemplates, Availability.ABSENT, null, allowedValues);
    }

    public OperationSpec unsupported(String why) {
        return new OperationSpec(name, kind, setTemplates, deleteTemplates, Availability.UNSUPPORTED, why, allowedValues);
    }

    public OperationSpec allowing(String param, Set<String> values) {
        Map<String, Set<String>> next = new LinkedHashMap<>(allowedValues);
        next.put(param, Set.copyOf(values));
        return new OperationSpec(name, kind, setTemplates, deleteTemplates, availability, reason, next);
    }

    public boolean requiresValue() {
        return kind == LeafKind.LEAF || kind == LeafKind.MULTI;
    }

    public Set<String> parameters() {
        Set<String> out = new LinkedHashSet<>();
        for (PathTemplate t : setTemplates) out.addAll(t.parameters());
        return out;
    }

    public List<Path> setPaths(Map<String, String> params) {
        checkAllowed(params);
        List<Path> out = new ArrayList<>(setTemplates.size());
        for (PathTemplate t : setTemplates) out.add(t.render(name, params));
        return out;
    }

    public List<Path> deletePaths(Map<String, String> params) {
        checkAllowed(params);
        if (kind == LeafKind.MULTI) {
            String v = params.get(PathTemplate.VALUE);
            PathTemplate t = setTemplates.get(0);
            return List.of((v == null || v.isBlank()) ? t.withoutTrailingValue().render(name, params) : t.render(name, params));
        }
        List<Path> out = new ArrayList<>(deleteTemplates.size());
        for (PathTemplate t : deleteTemplates) out.add(t.render(name, params));
        return out;
    }

    private void checkAllowed(Map<String, String> params) {
        for (var e : allowedValues.entrySet()) {
            String v = params.get(e.getKey());
            if (v == null || v.isBlank()) continue;
            if (!e.getValue().contains(v)) {
                throw new ValidationException("Invalid " + e.getKey() + " '" + v + "' for " + name
                        + "; expected one of " + e.getValue().stream().sorted().toList());
            }
        }
    }
}
