package dao.fhe.mystery.repository;

import dao.fhe.mystery.model.Batch;

import java.util.List;
import java.util.Optional;

public interface BatchRepository {

    void save(Batch batch);

    List<Batch> findAll();

    Optional<Batch> findById(long id);
}
