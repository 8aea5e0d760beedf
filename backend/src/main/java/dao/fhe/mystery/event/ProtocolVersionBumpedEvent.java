package dao.fhe.mystery.event;

/**
 * Every disclosure request bound to a version below {@code currentVersion} can no longer settle.
 */
public record ProtocolVersionBumpedEvent(
        long previousVersion,
        long currentVersion
) {}
