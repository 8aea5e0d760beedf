package dao.fhe.mystery.oracle;

import dao.fhe.mystery.model.CipherHandle;

import java.util.List;

public record DisclosureRequestMessage(
        long requestId,
        List<CipherHandle> values,
        long requestedAt
) {
    public DisclosureRequestMessage {
        values = List.copyOf(values);
    }
}
