package dao.fhe.mystery.service;

import dao.fhe.mystery.config.ProtocolProperties;
import dao.fhe.mystery.model.CipherHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommitmentHasherTest {

    private static final CipherHandle H1 = CipherHandle.uint("0x" + "01".repeat(32));
    private static final CipherHandle H2 = CipherHandle.uint("0x" + "02".repeat(32));

    private static CommitmentHasher hasher(String identity) {
        ProtocolProperties props = new ProtocolProperties();
        props.setIdentity(identity);
        return new CommitmentHasher(props);
    }

    @Test
    @DisplayName("Commitment is a 0x-prefixed 32-byte hex string and stable for equal input")
    void stable() {
        CommitmentHasher hasher = hasher("sealed-mystery");
        String c = hasher.commitment(List.of(H1, H2));
        assertTrue(c.matches("0x[0-9a-f]{64}"));
        assertEquals(c, hasher.commitment(List.of(CipherHandle.uint("0x" + "01".repeat(32)), H2)));
    }

    @Test
    @DisplayName("Handle order changes the commitment")
    void orderSensitive() {
        CommitmentHasher hasher = hasher("sealed-mystery");
        assertNotEquals(hasher.commitment(List.of(H1, H2)), hasher.commitment(List.of(H2, H1)));
    }

    @Test
    @DisplayName("Deployments with different identities commit differently to the same handles")
    void identityBound() {
        assertNotEquals(
                hasher("sealed-mystery").commitment(List.of(H1)),
                hasher("sealed-mystery/other").commitment(List.of(H1)));
    }

    @Test
    @DisplayName("Empty handle lists are refused")
    void empty() {
        assertThrows(IllegalArgumentException.class, () -> hasher("x").commitment(List.of()));
    }
}
