package com.cropcopilot.advisor.repository;

import com.cropcopilot.advisor.model.corpus.ProductEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ProductRepository extends JpaRepository<ProductEntity, String> {

    /**
     * @param names lowercase product names
     */
    @Query("SELECT p FROM ProductEntity p WHERE LOWER(p.name) IN :names")
    List<ProductEntity> findByLowerNameIn(@Param("names") Collection<String> names);

    List<ProductEntity> findTop20ByNameContainingIgnoreCaseOrderByNameAsc(String fragment);

    /**
     * @param types uppercase product types
     */
    @Query("SELECT p FROM ProductEntity p WHERE UPPER(p.productType) IN :types ORDER BY p.name ASC")
    List<ProductEntity> findByProductTypes(@Param("types") Collection<String> types);

    List<ProductEntity> findTop4ByOrderByNameAsc();
}
