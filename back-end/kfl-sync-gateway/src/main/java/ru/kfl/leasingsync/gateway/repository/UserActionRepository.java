package ru.kfl.leasingsync.gateway.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import ru.kfl.leasingsync.gateway.domain.UserAction;

import java.util.List;

public interface UserActionRepository extends JpaRepository<UserAction, Long> {

    List<UserAction> findByTelegramIdOrderByCreatedAtDesc(Long telegramId);

    List<UserAction> findByTelegramIdAndActionOrderByCreatedAtDesc(Long telegramId, String action);

    List<UserAction> findByActionOrderByCreatedAtDesc(String action);

    List<UserAction> findAllByOrderByCreatedAtDesc();
}
