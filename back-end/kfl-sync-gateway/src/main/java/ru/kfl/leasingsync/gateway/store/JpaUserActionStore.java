package ru.kfl.leasingsync.gateway.store;

import org.springframework.stereotype.Component;
import ru.kfl.leasingsync.gateway.domain.UserAction;
import ru.kfl.leasingsync.gateway.repository.UserActionRepository;
import ru.kfl.leasingsync.shared.store.AppendOnlyStore;

import java.util.List;
import java.util.Optional;

@Component
public class JpaUserActionStore implements AppendOnlyStore<Long, UserAction, UserActionFilter> {

    private final UserActionRepository actionRepo;

    public JpaUserActionStore(UserActionRepository actionRepo) {
        this.actionRepo = actionRepo;
    }

    @Override
    public Optional<UserAction> get(Long id) {
        return StoreCalls.guarded("load action " + id, () -> actionRepo.findById(id));
    }

    @Override
    public UserAction append(UserAction action) {
        if (action.getId() != null) {
            throw new IllegalArgumentException("user actions are append-only, id must be unset");
        }
        return StoreCalls.guarded("append action " + action.getAction(), () -> actionRepo.save(action));
    }

    @Override
    public List<UserAction> list(UserActionFilter filter) {
        return StoreCalls.guarded("list actions", () -> {
            if (filter.telegramId() != null && filter.action() != null) {
                return actionRepo.findByTelegramIdAndActionOrderByCreatedAtDesc(filter.telegramId(), filter.action());
            }
            if (filter.telegramId() != null) {
                return actionRepo.findByTelegramIdOrderByCreatedAtDesc(filter.telegramId());
            }
            if (filter.action() != null) {
                return actionRepo.findByActionOrderByCreatedAtDesc(filter.action());
            }
            return actionRepo.findAllByOrderByCreatedAtDesc();
        });
    }
}
