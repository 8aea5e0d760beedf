package dao.fhe.mystery.event;

import java.math.BigInteger;

/**
 * Decoded result of a solution disclosure: the plaintext aggregates of a batch.
 */
public record SolutionSettledEvent(
        long requestId,
        long batchId,
        BigInteger weapon,
        BigInteger room,
        BigInteger suspect
) {}
