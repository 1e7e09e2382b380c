package com.creditengine.purchase;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CreditProductRepository extends JpaRepository<CreditProduct, String> {

    List<CreditProduct> findByActiveTrueOrderByCreditsAsc();

    Optional<CreditProduct> findByProductIdAndActiveTrue(String productId);
}
