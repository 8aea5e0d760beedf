package dao.fhe.mystery.event;

import dao.fhe.mystery.model.DisclosureKind;

public record DisclosureRequestedEvent(
        long requestId,
        long batchId,
        String commitmentHash,
        DisclosureKind kind,
        String requester,
        long requestedAt
) {}
