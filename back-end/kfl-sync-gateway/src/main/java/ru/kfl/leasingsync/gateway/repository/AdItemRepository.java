package ru.kfl.leasingsync.gateway.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import ru.kfl.leasingsync.gateway.domain.AdItem;

import java.util.Optional;

public interface AdItemRepository extends JpaRepository<AdItem, Long>, JpaSpecificationExecutor<AdItem> {

    Optional<AdItem> findByAdId(String adId);

    long deleteByAdId(String adId);
}
