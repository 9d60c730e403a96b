package ru.kfl.leasingsync.gateway.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import ru.kfl.leasingsync.gateway.domain.TelegramUser;
import ru.kfl.leasingsync.shared.model.UserRole;

import java.util.List;
import java.util.Optional;

public interface TelegramUserRepository extends JpaRepository<TelegramUser, Long> {

    Optional<TelegramUser> findByTelegramId(Long telegramId);

    List<TelegramUser> findByRoleOrderByUpdatedAtDesc(UserRole role);

    List<TelegramUser> findAllByOrderByUpdatedAtDesc();
}
