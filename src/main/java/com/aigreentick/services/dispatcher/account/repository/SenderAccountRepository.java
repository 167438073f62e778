package com.aigreentick.services.dispatcher.account.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.aigreentick.services.dispatcher.account.model.SenderAccount;

public interface SenderAccountRepository extends JpaRepository<SenderAccount, Long> {

    List<SenderAccount> findByOwnerIdAndActiveTrueOrderByIdAsc(Long ownerId);

    long countByOwnerIdAndActiveTrue(Long ownerId);
}
