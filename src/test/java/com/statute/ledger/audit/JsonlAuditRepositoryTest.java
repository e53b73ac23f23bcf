package com.statute.ledger.audit;

import com.statute.ledger.decision.DecisionResult;
import com.statute.ledger.decision.EvaluatedCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonlAuditRepository Tests")
class JsonlAuditRepositoryTest {

    @TempDir
    Path tempDir;

    private static void appendThree(AuditLedger ledger) {
        DecisionContext context = new DecisionContext(Map.of("age", "30", "resident", "true"), Map.of("source", "intake"),
                List.of(new EvaluatedCondition("age >= 18", true)));
        ledger.append(EventType.AUTOMATIC_DECISION, Actor.system("engine"), "s-1", "p-1", context,
                DecisionResult.deterministic(true));
        ledger.append(EventType.DISCRETIONARY_REVIEW, Actor.user("u-7", "clerk"), "s-2", "p-2", context,
                DecisionResult.requiresDiscretion("Best interests of the child"));
        ledger.append(EventType.AUTOMATIC_DECISION, Actor.external("tax-office"), "s-3", "p-3",
                DecisionContext.empty(), DecisionResult.missingAttribute("income"));
    }

    @Test
    @DisplayName("Missing file reads as an empty store")
    void missingFile() {
        JsonlAuditRepository repository = new JsonlAuditRepository(tempDir.resolve("absent.jsonl"));
        assertTrue(repository.loadAll().isEmpty());
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("Writes one JSON object per record, including its hash")
    void oneLinePerRecord() throws IOException {
        Path file = tempDir.resolve("nested/audit.jsonl");
        AuditLedger ledger = new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file));
        appendThree(ledger);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        for (int i = 0; i < lines.size(); i++) {
            assertTrue(lines.get(i).startsWith("{\"actor\":"), lines.get(i));
            assertTrue(lines.get(i).contains("\"record_hash\":\"" + ledger.records().get(i).recordHash() + "\""));
        }
    }

    @Test
    @DisplayName("Reopened store reproduces identical records and an intact chain")
    void reload() {
        Path file = tempDir.resolve("audit.jsonl");
        AuditLedger ledger = new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file));
        appendThree(ledger);

        JsonlAuditRepository reopenedRepository = new JsonlAuditRepository(file);
        assertEquals(3, reopenedRepository.count());
        AuditLedger reopened = new AuditLedger(LedgerConfig.defaults(), reopenedRepository);

        assertEquals(ledger.records(), reopened.records());
        assertTrue(reopened.verify().valid());

        AuditRecord next = reopened.append(EventType.APPEAL, Actor.user("u-1", "appellant"), "s-1", "p-1",
                DecisionContext.empty(), DecisionResult.requiresDiscretion("Appeal pending"));
        assertEquals(ledger.tipHash().orElseThrow(), next.previousHash());
        assertEquals(4, new JsonlAuditRepository(file).loadAll().size());
    }

    @Test
    @DisplayName("Null context values are refused before anything reaches the store")
    void nullContextValues() {
        Path file = tempDir.resolve("audit.jsonl");
        AuditLedger ledger = new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file));
        Map<String, String> withNull = new HashMap<>();
        withNull.put("note", null);

        assertThrows(NullPointerException.class, () -> new DecisionContext(null, withNull, null));
        assertThrows(NullPointerException.class, () -> new DecisionContext(withNull, null, null));
        assertThrows(NullPointerException.class, () -> DecisionContext.empty().withMetadata("note", null));
        assertEquals(0, ledger.size());
        assertFalse(Files.exists(file));
    }

    @Test
    @DisplayName("Empty context values survive a reopen with an intact chain")
    void emptyContextValuesReload() {
        Path file = tempDir.resolve("audit.jsonl");
        AuditLedger ledger = new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file));
        DecisionContext context = new DecisionContext(Map.of("nationality", ""), null, null)
                .withMetadata("note", "");
        ledger.append(EventType.AUTOMATIC_DECISION, Actor.system("engine"), "s-1", "p-1", context,
                DecisionResult.deterministic(true));

        AuditLedger reopened = new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file));

        assertEquals(ledger.records(), reopened.records());
        assertEquals("", reopened.records().get(0).decisionContext().metadata().get("note"));
        assertTrue(reopened.verify().valid());
    }

    @Test
    @DisplayName("A null context value in the file is reported as unreadable")
    void nullValueInFile() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        AuditLedger ledger = new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file));
        ledger.append(EventType.AUTOMATIC_DECISION, Actor.system("engine"), "s-1", "p-1",
                DecisionContext.empty().withMetadata("note", "checked"), DecisionResult.deterministic(true));
        String line = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, line.replace("\"note\":\"checked\"", "\"note\":null"), StandardCharsets.UTF_8);

        JsonlAuditRepository repository = new JsonlAuditRepository(file);

        AuditStorageException e = assertThrows(AuditStorageException.class, repository::loadAll);
        assertTrue(e.getMessage().endsWith(":1"), e.getMessage());
    }

    @Test
    @DisplayName("Edited store is refused on open")
    void editedStore() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        appendThree(new AuditLedger(LedgerConfig.defaults(), new JsonlAuditRepository(file)));

        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, content.replace("\"subject_id\":\"p-2\"", "\"subject_id\":\"p-9\""),
                StandardCharsets.UTF_8);

        JsonlAuditRepository repository = new JsonlAuditRepository(file);
        ChainIntegrityException e = assertThrows(ChainIntegrityException.class,
                () -> new AuditLedger(LedgerConfig.defaults(), repository));
        assertEquals(1, e.getVerification().firstBrokenIndex());
        assertEquals(VerificationResult.Failure.HASH_MISMATCH, e.getVerification().failure());
    }

    @Test
    @DisplayName("Unreadable line is reported with its position")
    void unreadableLine() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        Files.writeString(file, "{not json}\n", StandardCharsets.UTF_8);

        AuditStorageException e = assertThrows(AuditStorageException.class, () -> new JsonlAuditRepository(file));
        assertTrue(e.getMessage().endsWith(":1"), e.getMessage());
    }
}
