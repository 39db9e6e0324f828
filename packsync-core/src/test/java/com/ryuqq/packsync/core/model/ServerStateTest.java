package com.ryuqq.packsync.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ServerState 복합 키 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ServerStateTest {

    @Test
    void keyOf_OrdinaryComponents_UsesDocumentedFormat() {
        // When
        String key = ServerState.keyOf("acme", "widget", "1.0.0", "npm", "stdio");

        // Then
        assertEquals("acme/widget@1.0.0:npm:stdio", key);
    }

    @Test
    void keyOf_SameInputs_IsDeterministic() {
        // When
        String first = ServerState.keyOf("acme", "widget", "1.0.0", "npm", "stdio");
        String second = ServerState.keyOf("acme", "widget", "1.0.0", "npm", "stdio");

        // Then
        assertEquals(first, second);
    }

    @Test
    void keyOf_DifferentComponents_ProduceDifferentKeys() {
        // Given
        List<String> keys = List.of(
            ServerState.keyOf("acme", "widget", "1.0.0", "npm", "stdio"),
            ServerState.keyOf("acme", "widget", "1.0.1", "npm", "stdio"),
            ServerState.keyOf("acme", "widget", "1.0.0", "pypi", "stdio"),
            ServerState.keyOf("acme", "widget", "1.0.0", "npm", "streamable-http"),
            ServerState.keyOf("acme", "gadget", "1.0.0", "npm", "stdio"),
            ServerState.keyOf("other", "widget", "1.0.0", "npm", "stdio")
        );

        // Then
        assertEquals(keys.size(), keys.stream().distinct().count());
    }

    @Test
    void keyOf_SeparatorInsideComponent_StaysInjective() {
        // Given: 구분자를 포함한 값이 경계를 옮겨도 같은 문자열이 되면 안 됨
        String shiftedVersion = ServerState.keyOf("acme", "widget", "1.0.0:npm", "x", "stdio");
        String shiftedType = ServerState.keyOf("acme", "widget", "1.0.0", "npm:x", "stdio");
        String atInName = ServerState.keyOf("acme", "w@1", "2", "npm", "stdio");
        String atInVersion = ServerState.keyOf("acme", "w", "1@2", "npm", "stdio");

        // Then
        assertNotEquals(shiftedVersion, shiftedType);
        assertNotEquals(atInName, atInVersion);
        assertEquals("acme/w%401@2:npm:stdio", atInName);
    }

    @Test
    void keyOf_PercentSign_IsEscapedFirst() {
        // When
        String literal = ServerState.keyOf("acme", "a%2Fb", "1", "npm", "stdio");
        String slash = ServerState.keyOf("acme", "a/b", "1", "npm", "stdio");

        // Then
        assertNotEquals(literal, slash);
        assertEquals("acme/a%252Fb@1:npm:stdio", literal);
        assertEquals("acme/a%2Fb@1:npm:stdio", slash);
    }

    @Test
    void generated_FromTask_SetsBothTimestamps() {
        // Given
        ServerPackage pkg = new ServerPackage("npm", "@acme/widget", "1.0.0", Transport.of("stdio"));
        ServerRecord record = ServerRecord.of("acme/widget", "1.0.0", ServerStatus.ACTIVE, List.of(pkg));
        GenerationTask task = new GenerationTask(record, pkg, ServerName.parse(record.name()));
        Instant now = Instant.parse("2025-01-01T00:00:00Z");

        // When
        ServerState state = ServerState.generated(task, now);

        // Then
        assertEquals("acme/widget@1.0.0:npm:stdio", state.key());
        assertEquals(task.stateKey(), state.key());
        assertEquals(now, state.updatedAt());
        assertEquals(now, state.generatedAt());
        assertEquals("", state.checksum());
    }

    @Test
    void constructor_NullNamespace_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new ServerState(null, "widget", "1.0.0", "npm", "stdio", null, null, null));
    }
}
