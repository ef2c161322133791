package com.vcc.router.repository;

import com.vcc.router.entity.ModelDescriptorEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ModelDescriptorRepository extends ReactiveCrudRepository<ModelDescriptorEntity, String> {

    @Query("SELECT * FROM model_descriptor ORDER BY model_id")
    Flux<ModelDescriptorEntity> findAllOrdered();
}
