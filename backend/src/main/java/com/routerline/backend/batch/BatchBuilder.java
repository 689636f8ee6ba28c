package com.routerline.backend.batch;

import com.routerline.backend.compiler.CapabilityMatrix;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.compiler.Path;
import com.routerline.backend.compiler.ResolvedMapper;
import com.routerline.backend.compiler.VersionTag;
import com.routerline.backend.error.ValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered instruction log for one feature family, one device version and one request.
 * <p>
 * Named operations resolve every path before touching the log, so a failing call leaves the log as it
 * was. Not thread-safe; a builder belongs to the request that opened it.
 */
public class BatchBuilder {

    public static final String RULE = "rule";

    private final ResolvedMapper mapper;
    private final List<Instruction> log = new ArrayList<>();
    private BatchState state = BatchState.EMPTY;

    public BatchBuilder(ResolvedMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public FeatureFamily family() { return mapper.family(); }
    public VersionTag version() { return mapper.version(); }
    public BatchState state() { return state; }
    public CapabilityMatrix capabilities() { return mapper.capabilities(); }

    // ---- raw appends ----

    public BatchBuilder addSet(Path path) {
        return append(List.of(path), Instruction.Kind.SET);
    }

    public BatchBuilder addSet(Path path, String value) {
        ensureOpen();
        if (path.isEmpty()) return this;
        if (value == null || value.isEmpty()) throw new ValidationException("set " + path + " requires a value");
        record(Instruction.set(path, value));
        return this;
    }

    public BatchBuilder addDelete(Path path) {
        return append(List.of(path), Instruction.Kind.DELETE);
    }

    // ---- named operations ----

    public BatchBuilder set(String operation) {
        return set(operation, Map.of());
    }

    public BatchBuilder set(String operation, Map<String, String> params) {
        ensureOpen();
        return append(mapper.resolveAll(operation, params), Instruction.Kind.SET);
    }

    public BatchBuilder delete(String operation) {
        return delete(operation, Map.of());
    }

    public BatchBuilder delete(String operation, Map<String, String> params) {
        ensureOpen();
        return append(mapper.resolveDelete(operation, params), Instruction.Kind.DELETE);
    }

    /**
     * Moves rules to new identifiers: every old rule is deleted first, then each is recreated under its
     * new number with its fields replayed. Old and new numbers may overlap.
     *
     * @param ruleOperation NODE operation addressing one rule, its template using {@code {rule}}
     * @param scope         parameters shared by all rules (list name, chain, ...)
     */
    public BatchBuilder renumber(String ruleOperation, Map<String, String> scope, List<RuleMove> moves) {
        ensureOpen();
        if (moves == null || moves.isEmpty()) throw new ValidationException("renumber requires at least one rule");

        Set<String> from = new HashSet<>();
        Set<String> to = new HashSet<>();
        for (RuleMove m : moves) {
            if (!from.add(m.from())) throw new ValidationException("rule " + m.from() + " listed twice");
            if (!to.add(m.to())) throw new ValidationException("target rule " + m.to() + " listed twice");
        }

        List<Instruction> deletes = new ArrayList<>();
        for (RuleMove m : moves) {
            for (Path p : mapper.resolveDelete(ruleOperation, withRule(scope, m.from()))) {
                if (!p.isEmpty()) deletes.add(Instruction.delete(p));
            }
        }

        List<Instruction> creates = new ArrayList<>();
        for (RuleMove m : moves) {
            Map<String, String> target = withRule(scope, m.to());
            if (m.fields().isEmpty()) {
                for (Path p : mapper.resolveAll(ruleOperation, target)) {
                    if (!p.isEmpty()) creates.add(Instruction.set(p));
                }
                continue;
            }
            for (RuleField f : m.fields()) {
                Map<String, String> params = new HashMap<>(target);
                params.putAll(f.params());
                params.put(RULE, m.to());
                for (Path p : mapper.resolveAll(f.operation(), params)) {
                    if (!p.isEmpty()) creates.add(Instruction.set(p));
                }
            }
        }

        deletes.forEach(this::record);
        creates.forEach(this::record);
        return this;
    }

    // ---- log access ----

    public List<Instruction> operations() {
        return List.copyOf(log);
    }

    public int operationCount() { return log.size(); }

    public boolean isEmpty() { return log.isEmpty(); }

    public void clear() {
        ensureOpen();
        log.clear();
        state = BatchState.EMPTY;
    }

    // ---- executor hooks ----

    void markSubmitted() {
        if (state != BatchState.ACCUMULATING) {
            throw new IllegalStateException("Batch cannot be submitted (state=" + state + ")");
        }
        state = BatchState.SUBMITTED;
    }

    void markCommitted() { transitionFromSubmitted(BatchState.COMMITTED); }

    void markRejected() { transitionFromSubmitted(BatchState.REJECTED); }

    private void transitionFromSubmitted(BatchState next) {
        if (state != BatchState.SUBMITTED) {
            throw new IllegalStateException("Batch is not SUBMITTED (state=" + state + ")");
        }
        state = next;
    }

    private BatchBuilder append(List<Path> paths, Instruction.Kind kind) {
        ensureOpen();
        for (Path p : paths) {
            if (p.isEmpty()) continue;
            record(new Instruction(kind, p, null));
        }
        return this;
    }

    private void record(Instruction i) {
        log.add(i);
        state = BatchState.ACCUMULATING;
    }

    private void ensureOpen() {
        if (state != BatchState.EMPTY && state != BatchState.ACCUMULATING) {
            throw new IllegalStateException("Batch already submitted (state=" + state + ")");
        }
    }

    private static Map<String, String> withRule(Map<String, String> scope, String rule) {
        Map<String, String> out = new HashMap<>(scope == null ? Map.of() : scope);
        out.put(RULE, rule);
        return out;
    }
}
