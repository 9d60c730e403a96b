package ru.kfl.leasingsync.gateway.store;

import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import ru.kfl.leasingsync.gateway.domain.AdItem;
import ru.kfl.leasingsync.gateway.repository.AdItemRepository;
import ru.kfl.leasingsync.shared.error.NotFoundException;
import ru.kfl.leasingsync.shared.store.DeletableStore;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
public class JpaAdItemStore implements DeletableStore<String, AdItem, AdFilter> {

    private static final Logger log = LoggerFactory.getLogger(JpaAdItemStore.class);

    private final AdItemRepository adRepo;
    private final TransactionTemplate tx;

    public JpaAdItemStore(AdItemRepository adRepo, TransactionTemplate tx) {
        this.adRepo = adRepo;
        this.tx = tx;
    }

    @Override
    public Optional<AdItem> get(String adId) {
        return StoreCalls.guarded("load ad " + adId, () -> adRepo.findByAdId(adId));
    }

    @Override
    public UpsertOutcome<AdItem> upsert(AdItem candidate) {
        return StoreCalls.guarded("upsert ad " + candidate.getAdId(), () -> {
            try {
                return tx.execute(status -> write(candidate));
            } catch (DataIntegrityViolationException race) {
                log.debug("Retrying upsert of ad {} as update", candidate.getAdId());
                return tx.execute(status -> write(candidate));
            }
        });
    }

    @Override
    public AdItem update(AdItem changed) {
        return StoreCalls.guarded("update ad " + changed.getAdId(), () -> tx.execute(status -> {
            AdItem existing = adRepo.findByAdId(changed.getAdId())
                    .orElseThrow(() -> new NotFoundException("ad not found"));
            existing.replaceContentWith(changed);
            return adRepo.saveAndFlush(existing);
        }));
    }

    @Override
    public boolean delete(String adId) {
        return StoreCalls.guarded("delete ad " + adId,
                () -> Boolean.TRUE.equals(tx.execute(status -> adRepo.deleteByAdId(adId) > 0)));
    }

    @Override
    public List<AdItem> list(AdFilter filter) {
        Specification<AdItem> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.authorTelegramId() != null) {
                predicates.add(cb.equal(root.get("authorTelegramId"), filter.authorTelegramId()));
            }
            if (filter.status() != null) {
                predicates.add(cb.equal(root.get("status"), filter.status()));
            }
            if (filter.sourceType() != null) {
                predicates.add(cb.equal(root.get("sourceType"), filter.sourceType()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return StoreCalls.guarded("list ads",
                () -> adRepo.findAll(spec, Sort.by(Sort.Direction.DESC, "updatedAt")));
    }

    private UpsertOutcome<AdItem> write(AdItem candidate) {
        return adRepo.findByAdId(candidate.getAdId())
                .map(existing -> {
                    existing.replaceContentWith(candidate);
                    return UpsertOutcome.updated(adRepo.saveAndFlush(existing));
                })
                .orElseGet(() -> UpsertOutcome.created(adRepo.saveAndFlush(candidate)));
    }
}
