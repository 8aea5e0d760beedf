package dao.fhe.mystery.repository;

import dao.fhe.mystery.model.Batch;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryBatchRepository implements BatchRepository {

    // key: batch id
    private final Map<Long, Batch> batchesById = new ConcurrentHashMap<>();

    @Override
    public void save(Batch batch) {
        if (batch.getId() <= 0L) {
            throw new IllegalArgumentException("Batch id must be assigned before save: " + batch.getId());
        }
        batchesById.put(batch.getId(), batch);
    }

    @Override
    public List<Batch> findAll() {
        List<Batch> all = new ArrayList<>(batchesById.values());
        all.sort(Comparator.comparingLong(Batch::getId));
        return all;
    }

    @Override
    public Optional<Batch> findById(long id) {
        return Optional.ofNullable(batchesById.get(id));
    }
}
