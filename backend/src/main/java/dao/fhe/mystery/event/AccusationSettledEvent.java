package dao.fhe.mystery.event;

/**
 * Decoded result of an accusation disclosure: whether the player's guess matched every field.
 */
public record AccusationSettledEvent(
        long requestId,
        long batchId,
        String player,
        boolean correct
) {}
