package com.routerline.backend.batch;

import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.compiler.Path;
import com.routerline.backend.compiler.VersionResolver;
import com.routerline.backend.compiler.VersionTag;
import com.routerline.backend.error.CapabilityException;
import com.routerline.backend.error.UnknownOperationException;
import com.routerline.backend.error.ValidationException;
import com.routerline.backend.grammar.GrammarConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BatchBuilderTest {

    private static final VersionResolver RESOLVER = new VersionResolver(GrammarConfig.all());

    private static BatchBuilder open(FeatureFamily family, VersionTag version) {
        return new BatchBuilder(RESOLVER.forTag(family, version));
    }

    private static List<String> lines(BatchBuilder b) {
        return b.operations().stream().map(Instruction::toString).toList();
    }

    @Test
    void newBuilder_isEmpty() {
        BatchBuilder b = open(FeatureFamily.NAT, VersionTag.V1_5);

        assertTrue(b.isEmpty());
        assertEquals(0, b.operationCount());
        assertEquals(BatchState.EMPTY, b.state());
    }

    @Test
    void createDomainGroup_onOlderFirmware_appendsNothing() {
        BatchBuilder b = open(FeatureFamily.FIREWALL_GROUPS, VersionTag.V1_4);
        b.set("address-group", Map.of("name", "LAN"));

        assertThrows(CapabilityException.class, () -> b.set("domain-group", Map.of("name", "INTERNAL")));

        assertEquals(1, b.operationCount());
    }

    @Test
    void createDomainGroup_onNewerFirmware_isValuelessSet() {
        BatchBuilder b = open(FeatureFamily.FIREWALL_GROUPS, VersionTag.V1_5);

        b.set("domain-group", Map.of("name", "INTERNAL"));

        Instruction i = b.operations().get(0);
        assertEquals(Instruction.Kind.SET, i.kind());
        assertEquals(Path.of("firewall", "group", "domain-group", "INTERNAL"), i.path());
        assertNull(i.value());
        assertEquals(BatchState.ACCUMULATING, b.state());
    }

    @Test
    void operations_keepInsertionOrder() {
        BatchBuilder b = open(FeatureFamily.FIREWALL_IPV4, VersionTag.V1_5);
        Map<String, String> rule = Map.of("chain", "input", "rule", "10");

        b.set("chain.rule", rule);
        b.set("chain.rule.action", with(rule, "value", "accept"));
        b.delete("chain.rule.description", rule);
        b.set("chain.rule.tcp.flags", with(rule, "value", "syn !ack"));

        assertEquals(List.of(
                "set firewall ipv4 input filter rule 10",
                "set firewall ipv4 input filter rule 10 action accept",
                "delete firewall ipv4 input filter rule 10 description",
                "set firewall ipv4 input filter rule 10 tcp flags syn !ack"
        ), lines(b));
    }

    @Test
    void addSet_emptyPath_isSkipped() {
        BatchBuilder b = open(FeatureFamily.NAT, VersionTag.V1_5);

        b.addSet(Path.EMPTY);
        b.addDelete(Path.EMPTY);
        b.addSet(Path.EMPTY, "x");

        assertTrue(b.isEmpty());
        assertEquals(BatchState.EMPTY, b.state());
    }

    @Test
    void addSet_withValue_sendsValueAsLastToken() {
        BatchBuilder b = open(FeatureFamily.NAT, VersionTag.V1_5);

        b.addSet(Path.of("nat", "source", "rule", "100", "description"), "to wan");

        Instruction i = b.operations().get(0);
        assertEquals("to wan", i.value());
        assertEquals(List.of("nat", "source", "rule", "100", "description", "to wan"), i.wirePath());
    }

    @Test
    void absentField_isSkippedSilently() {
        BatchBuilder b = open(FeatureFamily.DHCP, VersionTag.V1_4);

        b.set("shared-network.subnet.subnet-id", Map.of("network", "LAN", "subnet", "10.0.0.0/24", "value", "1"));

        assertTrue(b.isEmpty());
    }

    @Test
    void compound_emitsAllPathsInOrder() {
        BatchBuilder b = open(FeatureFamily.ACCESS_LIST, VersionTag.V1_5);
        Map<String, String> p = Map.of("list", "100", "rule", "5", "network", "10.0.0.0", "mask", "0.0.0.255");

        b.set("ipv4.rule.source.inverse-mask", p);
        b.delete("ipv4.rule.source.inverse-mask", p);

        assertEquals(List.of(
                "set policy access-list 100 rule 5 source network 10.0.0.0",
                "set policy access-list 100 rule 5 source inverse-mask 0.0.0.255",
                "delete policy access-list 100 rule 5 source network",
                "delete policy access-list 100 rule 5 source inverse-mask"
        ), lines(b));
    }

    @Test
    void compound_missingParameter_appendsNothing() {
        BatchBuilder b = open(FeatureFamily.ACCESS_LIST, VersionTag.V1_5);

        var e = assertThrows(ValidationException.class, () -> b.set("ipv4.rule.source.inverse-mask",
                Map.of("list", "100", "rule", "5", "network", "10.0.0.0")));

        assertEquals("Operation ipv4.rule.source.inverse-mask requires 'mask'", e.getMessage());
        assertTrue(b.isEmpty());
    }

    @Test
    void valueOutsideVocabulary_isValidationError() {
        BatchBuilder b = open(FeatureFamily.FIREWALL_IPV4, VersionTag.V1_5);

        assertThrows(ValidationException.class, () ->
                b.set("chain.rule.action", Map.of("chain", "input", "rule", "1", "value", "allow")));
        assertThrows(ValidationException.class, () ->
                b.set("chain.rule", Map.of("chain", "prerouting", "rule", "1")));
        assertTrue(b.isEmpty());
    }

    @Test
    void unknownOperation_isRejected() {
        BatchBuilder b = open(FeatureFamily.NAT, VersionTag.V1_5);

        assertThrows(UnknownOperationException.class, () -> b.set("source.rule.nonsense", Map.of()));
    }

    @Test
    void multiDelete_removesOneValueOrWholeLeaf() {
        BatchBuilder b = open(FeatureFamily.FIREWALL_GROUPS, VersionTag.V1_5);

        b.delete("address-group.address", Map.of("name", "LAN", "value", "10.0.0.1"));
        b.delete("address-group.address", Map.of("name", "LAN"));

        assertEquals(List.of(
                "delete firewall group address-group LAN address 10.0.0.1",
                "delete firewall group address-group LAN address"
        ), lines(b));
    }

    @Test
    void renumber_deletesAllOldRulesBeforeRecreating() {
        BatchBuilder b = open(FeatureFamily.FIREWALL_IPV4, VersionTag.V1_5);

        b.renumber("chain.rule", Map.of("chain", "input"), List.of(
                new RuleMove("10", "20", List.of(
                        RuleField.of("chain.rule.action", "accept"),
                        RuleField.flag("chain.rule.log"))),
                new RuleMove("20", "30", List.of())
        ));

        assertEquals(List.of(
                "delete firewall ipv4 input filter rule 10",
                "delete firewall ipv4 input filter rule 20",
                "set firewall ipv4 input filter rule 20 action accept",
                "set firewall ipv4 input filter rule 20 log",
                "set firewall ipv4 input filter rule 30"
        ), lines(b));
    }

    @Test
    void renumber_rejectsDuplicateTargets() {
        BatchBuilder b = open(FeatureFamily.PREFIX_LIST, VersionTag.V1_5);
        Map<String, String> scope = Map.of("list", "PL");

        assertThrows(ValidationException.class, () -> b.renumber("ipv4.rule", scope, List.of(
                new RuleMove("1", "5", List.of()),
                new RuleMove("2", "5", List.of()))));
        assertThrows(ValidationException.class, () -> b.renumber("ipv4.rule", scope, List.of()));
        assertTrue(b.isEmpty());
    }

    @Test
    void clear_resetsToEmpty() {
        BatchBuilder b = open(FeatureFamily.NAT, VersionTag.V1_5);
        b.set("source.rule", Map.of("rule", "100"));

        b.clear();

        assertTrue(b.isEmpty());
        assertEquals(BatchState.EMPTY, b.state());
    }

    @Test
    void submittedBatch_refusesFurtherAppends() {
        BatchBuilder b = open(FeatureFamily.NAT, VersionTag.V1_5);
        b.set("source.rule", Map.of("rule", "100"));

        b.markSubmitted();
        b.markCommitted();

        assertEquals(BatchState.COMMITTED, b.state());
        assertThrows(IllegalStateException.class, () -> b.set("source.rule", Map.of("rule", "101")));
        assertThrows(IllegalStateException.class, b::clear);
        assertFalse(b.isEmpty());
    }

    private static Map<String, String> with(Map<String, String> base, String key, String value) {
        Map<String, String> out = new HashMap<>(base);
        out.put(key, value);
        return out;
    }
}
