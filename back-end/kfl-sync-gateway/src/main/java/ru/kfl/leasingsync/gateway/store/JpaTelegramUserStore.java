package ru.kfl.leasingsync.gateway.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import ru.kfl.leasingsync.gateway.domain.TelegramUser;
import ru.kfl.leasingsync.gateway.repository.TelegramUserRepository;
import ru.kfl.leasingsync.shared.store.KeyedStore;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.util.List;
import java.util.Optional;

@Component
public class JpaTelegramUserStore implements KeyedStore<Long, TelegramUser, UserFilter> {

    private static final Logger log = LoggerFactory.getLogger(JpaTelegramUserStore.class);

    private final TelegramUserRepository userRepo;
    private final TransactionTemplate tx;

    public JpaTelegramUserStore(TelegramUserRepository userRepo, TransactionTemplate tx) {
        this.userRepo = userRepo;
        this.tx = tx;
    }

    @Override
    public Optional<TelegramUser> get(Long telegramId) {
        return StoreCalls.guarded("load user " + telegramId, () -> userRepo.findByTelegramId(telegramId));
    }

    @Override
    public UpsertOutcome<TelegramUser> upsert(TelegramUser candidate) {
        return StoreCalls.guarded("upsert user " + candidate.getTelegramId(), () -> {
            try {
                return tx.execute(status -> write(candidate));
            } catch (DataIntegrityViolationException race) {
                // another request inserted the same telegram_id first
                log.debug("Retrying upsert of user {} as update", candidate.getTelegramId());
                return tx.execute(status -> write(candidate));
            }
        });
    }

    @Override
    public List<TelegramUser> list(UserFilter filter) {
        return StoreCalls.guarded("list users", () -> filter.role() == null
                ? userRepo.findAllByOrderByUpdatedAtDesc()
                : userRepo.findByRoleOrderByUpdatedAtDesc(filter.role()));
    }

    private UpsertOutcome<TelegramUser> write(TelegramUser candidate) {
        return userRepo.findByTelegramId(candidate.getTelegramId())
                .map(existing -> {
                    existing.replaceWith(candidate);
                    return UpsertOutcome.updated(userRepo.saveAndFlush(existing));
                })
                .orElseGet(() -> UpsertOutcome.created(userRepo.saveAndFlush(candidate)));
    }
}
