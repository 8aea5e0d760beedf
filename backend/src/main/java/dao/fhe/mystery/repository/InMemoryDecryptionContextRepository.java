package dao.fhe.mystery.repository;

import dao.fhe.mystery.model.DecryptionContext;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDecryptionContextRepository implements DecryptionContextRepository {

    // key: oracle request id
    private final Map<Long, DecryptionContext> contextsByRequestId = new ConcurrentHashMap<>();

    @Override
    public void save(DecryptionContext context) {
        contextsByRequestId.put(context.getRequestId(), context);
    }

    @Override
    public List<DecryptionContext> findAll() {
        List<DecryptionContext> all = new ArrayList<>(contextsByRequestId.values());
        all.sort(Comparator.comparingLong(DecryptionContext::getRequestId));
        return all;
    }

    @Override
    public Optional<DecryptionContext> findByRequestId(long requestId) {
        return Optional.ofNullable(contextsByRequestId.get(requestId));
    }
}
